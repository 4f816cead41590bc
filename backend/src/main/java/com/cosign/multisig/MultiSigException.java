package com.cosign.multisig;

import com.cosign.chain.ExecutionFailureReason;
import lombok.Getter;

/**
 * Rejected multi-sig operation. The API layer maps {@link #errorCode} to an HTTP status.
 */
@Getter
public class MultiSigException extends RuntimeException {

    private final MultiSigErrorCode errorCode;
    /** Set for EXECUTION_FAILED and DEPLOYMENT_FAILED. */
    private final ExecutionFailureReason failureReason;

    public MultiSigException(MultiSigErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public MultiSigException(MultiSigErrorCode errorCode, String message, ExecutionFailureReason failureReason, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.failureReason = failureReason;
    }

    public static MultiSigException notFound(String what, String id) {
        return new MultiSigException(MultiSigErrorCode.NOT_FOUND, what + " not found: " + id);
    }
}
