package com.cosign.chain;

import lombok.Getter;

/**
 * Structured failure of a chain interaction. Recoverable: callers keep state retryable.
 */
@Getter
public class ChainExecutionException extends RuntimeException {

    private final ExecutionFailureReason reason;

    public ChainExecutionException(ExecutionFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ChainExecutionException(ExecutionFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Maps a raw RPC failure to a failure reason. */
    public static ChainExecutionException from(String operation, RpcException e) {
        return new ChainExecutionException(classify(e), operation + " failed: " + e.getMessage(), e);
    }

    static ExecutionFailureReason classify(RpcException e) {
        if (e.isTimeout()) {
            return ExecutionFailureReason.TIMEOUT;
        }
        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        if (message.contains("insufficient funds")) {
            return ExecutionFailureReason.INSUFFICIENT_FUNDS;
        }
        if (message.contains("revert") || Integer.valueOf(3).equals(e.getRpcErrorCode())) {
            return ExecutionFailureReason.REVERTED;
        }
        return ExecutionFailureReason.RPC_UNAVAILABLE;
    }
}
