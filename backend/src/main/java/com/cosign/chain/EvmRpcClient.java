package com.cosign.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Endpoint selection, retries and timeouts are handled by {@link JsonRpcChainClient}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      positional params
     * @return raw response body (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
