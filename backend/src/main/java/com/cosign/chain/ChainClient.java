package com.cosign.chain;

import com.cosign.domain.ChainId;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Capability object for one EVM chain. All methods block; every RPC is bounded by the configured timeout.
 * Failures surface as {@link RpcException} (reads) or {@link ChainExecutionException} (submission, receipts).
 */
public interface ChainClient {

    ChainId chain();

    /** EIP-155 chain id as reported by the node; must match {@link ChainId#getEvmChainId()}. */
    long chainId();

    /** eth_call against latest state; returns the raw hex result. */
    String call(ContractCall call);

    BigInteger estimateGas(ContractCall call);

    /** Submits once from the relayer account and returns the transaction hash. Never retried. */
    String submit(ContractCall call);

    ChainReceipt waitForReceipt(String txHash, int confirmations, Duration timeout);
}
