package com.cosign.chain.config;

import com.cosign.domain.ChainId;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chain connectivity and on-chain execution settings. Per-chain entries are keyed by {@link ChainId} name
 * (e.g. ETHEREUM, POLYGON). A chain without an entry, or with on-chain-enabled=false, runs off-chain only.
 */
@ConfigurationProperties(prefix = "cosign.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** Safe proxy factory 1.3.0 (canonical deployment). */
    public static final String DEFAULT_FACTORY_ADDRESS = "0xa6b71e26c5e0845f74c812102ca7114b6a896ab2";
    /** Safe singleton 1.3.0 (canonical deployment). */
    public static final String DEFAULT_SINGLETON_ADDRESS = "0xd9db270c1b5e3bd161e8c8503c55ceabee709552";
    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private Duration rpcTimeout = Duration.ofSeconds(15);
    private Duration receiptTimeout = Duration.ofMinutes(3);
    private Duration receiptPollInterval = Duration.ofSeconds(2);
    private int maxRequestsPerSecond = 10;
    /** Max wait for a local limiter permit before the call fails. */
    private long localLimiterTimeoutMs = 5000L;
    private Retry retry = new Retry();
    private Map<ChainId, NetworkEntry> network = new EnumMap<>(ChainId.class);

    public void setNetwork(Map<ChainId, NetworkEntry> network) {
        this.network = network != null ? network : new EnumMap<>(ChainId.class);
    }

    public void setRetry(Retry retry) {
        this.retry = retry != null ? retry : new Retry();
    }

    /** Entry for the chain, or null when it is not configured. */
    public NetworkEntry entry(ChainId chain) {
        return network.get(chain);
    }

    public boolean isOnChainEnabled(ChainId chain) {
        NetworkEntry entry = network.get(chain);
        return chain.isEvm() && entry != null && entry.isOnChainEnabled();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        private long baseDelayMs = 500L;
        private double jitterFactor = 0.2;
        private int maxAttempts = 3;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEntry {

        private boolean onChainEnabled;
        private List<String> urls = new ArrayList<>();
        /** Node- or remote-signer-managed account that pays for deployments and executions. */
        private String relayerAddress;
        private String factoryAddress = DEFAULT_FACTORY_ADDRESS;
        private String singletonAddress = DEFAULT_SINGLETON_ADDRESS;
        private String fallbackHandler = ZERO_ADDRESS;
        private int confirmations = 1;
        /** Gas limit used when estimation fails. */
        private BigInteger execGasLimit = BigInteger.valueOf(300_000L);

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
