package com.cosign.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.cosign.domain.ChainId;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link ChainClient} over EVM JSON-RPC. Reads rotate across endpoints with backoff; eth_sendTransaction is
 * sent once, from the relayer account managed by the node or a remote signer (this service holds no keys).
 */
@Slf4j
public class JsonRpcChainClient implements ChainClient {

    /** Methods whose result may be JSON null (receipt not yet mined). */
    private static final Set<String> NULLABLE_RESULTS = Set.of("eth_getTransactionReceipt");

    private final ChainId chain;
    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final String relayerAddress;
    private final Duration rpcTimeout;
    private final Duration receiptPollInterval;
    private final long limiterLogThresholdMs;

    private volatile Long verifiedChainId;

    public JsonRpcChainClient(ChainId chain, EvmRpcClient rpcClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                              ObjectMapper objectMapper, String relayerAddress, Duration rpcTimeout,
                              Duration receiptPollInterval, long limiterLogThresholdMs) {
        this.chain = chain;
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.relayerAddress = relayerAddress;
        this.rpcTimeout = rpcTimeout;
        this.receiptPollInterval = receiptPollInterval;
        this.limiterLogThresholdMs = limiterLogThresholdMs;
    }

    @Override
    public ChainId chain() {
        return chain;
    }

    @Override
    public long chainId() {
        Long cached = verifiedChainId;
        if (cached != null) {
            return cached;
        }
        long reported = Numeric.decodeQuantity(readWithRetry("eth_chainId", List.of()).asText()).longValueExact();
        Long expected = chain.getEvmChainId();
        if (expected != null && expected != reported) {
            throw new RpcException("Endpoint for " + chain + " reports chain id " + reported + ", expected " + expected);
        }
        verifiedChainId = reported;
        return reported;
    }

    @Override
    public String call(ContractCall call) {
        return readWithRetry("eth_call", List.of(callObject(call, false), "latest")).asText();
    }

    @Override
    public BigInteger estimateGas(ContractCall call) {
        return Numeric.decodeQuantity(readWithRetry("eth_estimateGas", List.of(callObject(call, false))).asText());
    }

    @Override
    public String submit(ContractCall call) {
        if (relayerAddress == null || relayerAddress.isBlank()) {
            throw new ChainExecutionException(ExecutionFailureReason.UNSUPPORTED_CHAIN,
                    "No relayer account configured for " + chain);
        }
        String endpoint = rotator.getNextEndpoint();
        try {
            String txHash = invoke(endpoint, "eth_sendTransaction", List.of(callObject(call, true))).asText();
            log.info("Submitted transaction {} to {} on {}", txHash, call.to(), chain);
            return txHash;
        } catch (RpcException e) {
            throw ChainExecutionException.from("eth_sendTransaction", e);
        }
    }

    @Override
    public ChainReceipt waitForReceipt(String txHash, int confirmations, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int required = Math.max(1, confirmations);
        while (true) {
            try {
                JsonNode receipt = readWithRetry("eth_getTransactionReceipt", List.of(txHash));
                if (!receipt.isNull()) {
                    ChainReceipt parsed = toReceipt(txHash, receipt);
                    if (required == 1 || confirmationsOf(parsed) >= required) {
                        return parsed;
                    }
                }
            } catch (RpcException e) {
                throw ChainExecutionException.from("eth_getTransactionReceipt", e);
            }
            if (System.nanoTime() >= deadline) {
                throw new ChainExecutionException(ExecutionFailureReason.TIMEOUT,
                        "No receipt for " + txHash + " on " + chain + " within " + timeout);
            }
            sleep(receiptPollInterval);
        }
    }

    private long confirmationsOf(ChainReceipt receipt) {
        long head = Numeric.decodeQuantity(readWithRetry("eth_blockNumber", List.of()).asText()).longValue();
        return head - receipt.blockNumber() + 1;
    }

    private JsonNode readWithRetry(String method, Object params) {
        RpcException last = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(Duration.ofMillis(rotator.retryDelayMs(attempt - 1)));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return invoke(endpoint, method, params);
            } catch (RpcException e) {
                if (e.isDeterministic()) {
                    throw e;
                }
                last = e;
                log.warn("{} on {} attempt {}/{} failed: {}", method, endpoint, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        throw new RpcException(method + " on " + chain + " failed after " + rotator.getMaxAttempts() + " attempts",
                last, null, last != null && last.isTimeout());
    }

    private JsonNode invoke(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        String body = rpcClient.call(endpoint, method, params)
                .timeout(rpcTimeout, Mono.error(() -> RpcException.timeout(method, endpoint)))
                .block();
        if (body == null) {
            throw new RpcException(method + " returned an empty body from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw RpcException.rpcError(method, error.path("code").asInt(), error.path("message").asText());
        }
        JsonNode result = root.get("result");
        if (result == null || (result.isNull() && !NULLABLE_RESULTS.contains(method))) {
            throw new RpcException(method + " response from " + endpoint + " carries neither result nor error");
        }
        return result;
    }

    private Map<String, Object> callObject(ContractCall call, boolean forSubmission) {
        Map<String, Object> tx = new LinkedHashMap<>();
        if (relayerAddress != null && !relayerAddress.isBlank()) {
            tx.put("from", relayerAddress);
        }
        tx.put("to", call.to());
        tx.put("data", call.data());
        if (call.value().signum() > 0) {
            tx.put("value", Numeric.encodeQuantity(call.value()));
        }
        if (forSubmission && call.gasLimit() != null) {
            tx.put("gas", Numeric.encodeQuantity(call.gasLimit()));
        }
        return tx;
    }

    private ChainReceipt toReceipt(String txHash, JsonNode receipt) {
        String blockHex = receipt.path("blockNumber").asText(null);
        if (blockHex == null) {
            throw new ChainExecutionException(ExecutionFailureReason.MALFORMED_RECEIPT, "Receipt without block number: " + txHash);
        }
        List<ChainLog> logs = new ArrayList<>();
        for (JsonNode log : receipt.path("logs")) {
            List<String> topics = new ArrayList<>();
            log.path("topics").forEach(t -> topics.add(t.asText()));
            logs.add(new ChainLog(log.path("address").asText(null), topics, log.path("data").asText("0x")));
        }
        return new ChainReceipt(
                txHash,
                Numeric.decodeQuantity(blockHex).longValue(),
                "0x1".equals(receipt.path("status").asText()),
                receipt.path("from").asText(null),
                receipt.path("to").asText(null),
                logs);
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while waiting", e);
        }
    }
}
