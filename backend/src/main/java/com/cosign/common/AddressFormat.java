package com.cosign.common;

/**
 * Address syntax family of a chain. Decides how {@link AddressNormalizer} validates and canonicalizes.
 */
public enum AddressFormat {
    /** 0x + 40 hex, canonical form is the EIP-55 checksum. */
    EVM,
    /** Base58, 32-44 chars, case-sensitive. */
    SOLANA
}
