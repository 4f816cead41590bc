package com.cosign.chain;

import lombok.Getter;

/**
 * Thrown when a chain RPC call fails: transport error, JSON-RPC error object, or timeout.
 */
@Getter
public class RpcException extends RuntimeException {

    /** JSON-RPC error code when the node answered with an error object, otherwise null. */
    private final Integer rpcErrorCode;
    private final boolean timeout;

    public RpcException(String message) {
        this(message, null, null, false);
    }

    public RpcException(String message, Throwable cause) {
        this(message, cause, null, false);
    }

    public RpcException(String message, Throwable cause, Integer rpcErrorCode, boolean timeout) {
        super(message, cause);
        this.rpcErrorCode = rpcErrorCode;
        this.timeout = timeout;
    }

    public static RpcException rpcError(String method, int code, String message) {
        return new RpcException(method + " error " + code + ": " + message, null, code, false);
    }

    public static RpcException timeout(String method, String endpoint) {
        return new RpcException("Timed out waiting for " + method + " on " + endpoint, null, null, true);
    }

    /** JSON-RPC answered; retrying the same request will give the same answer. */
    public boolean isDeterministic() {
        return rpcErrorCode != null;
    }
}
