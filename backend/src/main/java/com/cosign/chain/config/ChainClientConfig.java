package com.cosign.chain.config;

import com.cosign.chain.ChainClient;
import com.cosign.chain.ChainClientRegistry;
import com.cosign.chain.EvmRpcClient;
import com.cosign.chain.JsonRpcChainClient;
import com.cosign.chain.RpcEndpointRotator;
import com.cosign.chain.WebClientEvmRpcClient;
import com.cosign.common.RetryPolicy;
import com.cosign.domain.ChainId;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds one {@link ChainClient} per EVM chain that has RPC urls under cosign.chain.network.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainClientConfig {

    /** Limiter waits at or above this are logged. */
    private static final long LIMITER_LOG_THRESHOLD_MS = 100L;

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    @Bean
    public ChainClientRegistry chainClientRegistry(ChainProperties properties, EvmRpcClient evmRpcClient,
                                                   @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
                                                   ObjectMapper objectMapper) {
        ChainProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        Map<ChainId, ChainClient> clients = new EnumMap<>(ChainId.class);
        properties.getNetwork().forEach((chain, entry) -> {
            if (!chain.isEvm() || entry == null || entry.getUrls().isEmpty()) {
                return;
            }
            clients.put(chain, new JsonRpcChainClient(
                    chain,
                    evmRpcClient,
                    new RpcEndpointRotator(entry.getUrls(), retryPolicy),
                    rateLimiter,
                    objectMapper,
                    entry.getRelayerAddress(),
                    properties.getRpcTimeout(),
                    properties.getReceiptPollInterval(),
                    LIMITER_LOG_THRESHOLD_MS));
            log.info("Chain client for {} with {} endpoint(s), on-chain execution {}",
                    chain, entry.getUrls().size(), entry.isOnChainEnabled() ? "enabled" : "disabled");
        });
        return new ChainClientRegistry(clients);
    }
}
