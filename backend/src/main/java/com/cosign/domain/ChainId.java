package com.cosign.domain;

import com.cosign.common.AddressFormat;

/**
 * Supported chain identifier. EVM chains carry their EIP-155 chain id.
 */
public enum ChainId {
    ETHEREUM(1L, AddressFormat.EVM),
    POLYGON(137L, AddressFormat.EVM),
    ARBITRUM(42161L, AddressFormat.EVM),
    OPTIMISM(10L, AddressFormat.EVM),
    CELO(42220L, AddressFormat.EVM),
    BASE(8453L, AddressFormat.EVM),
    SOLANA(null, AddressFormat.SOLANA);

    private final Long evmChainId;
    private final AddressFormat addressFormat;

    ChainId(Long evmChainId, AddressFormat addressFormat) {
        this.evmChainId = evmChainId;
        this.addressFormat = addressFormat;
    }

    /** EIP-155 chain id, or null for non-EVM chains. */
    public Long getEvmChainId() {
        return evmChainId;
    }

    public AddressFormat getAddressFormat() {
        return addressFormat;
    }

    public boolean isEvm() {
        return addressFormat == AddressFormat.EVM;
    }
}
