package com.cosign.multisig;

/**
 * Outcome codes for rejected multi-sig operations. Every code is a per-operation outcome; none is fatal.
 */
public enum MultiSigErrorCode {
    INVALID_ADDRESS,
    INVALID_AMOUNT,
    INVALID_SIGNATURE,
    /** threshold &lt; 1 or threshold &gt; signer count, at creation or after a removal. */
    THRESHOLD_INVARIANT_VIOLATED,
    NOT_FOUND,
    NOT_PENDING,
    EXPIRED,
    ALREADY_SIGNED,
    DUPLICATE_SIGNER,
    UNAUTHORIZED,
    THRESHOLD_NOT_MET,
    EXECUTION_IN_PROGRESS,
    /** Optimistic retries exhausted under contention. */
    CONCURRENT_UPDATE,
    DEPLOYMENT_FAILED,
    EXECUTION_FAILED,
    ON_CHAIN_UNSUPPORTED_FOR_CHAIN
}
