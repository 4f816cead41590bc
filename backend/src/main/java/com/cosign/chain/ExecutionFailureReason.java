package com.cosign.chain;

/**
 * Why an on-chain deployment or execution did not complete.
 */
public enum ExecutionFailureReason {
    REVERTED,
    INSUFFICIENT_FUNDS,
    RPC_UNAVAILABLE,
    TIMEOUT,
    MISSING_SIGNATURES,
    MALFORMED_RECEIPT,
    /** Chain has no on-chain execution path (non-EVM, disabled, or not configured). */
    UNSUPPORTED_CHAIN
}
