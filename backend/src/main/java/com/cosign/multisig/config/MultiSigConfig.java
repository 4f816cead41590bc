package com.cosign.multisig.config;

import com.cosign.common.KeyedLocks;
import com.cosign.multisig.execution.ExternalSigner;
import com.cosign.multisig.execution.UnavailableExternalSigner;
import com.cosign.multisig.service.MultiSigProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Multi-sig collaborators that have no component of their own.
 */
@Configuration
@EnableConfigurationProperties(MultiSigProperties.class)
public class MultiSigConfig {

    /** Per-transaction and per-wallet locks for the service's critical sections. */
    @Bean
    public KeyedLocks multiSigLocks() {
        return new KeyedLocks();
    }

    /** Replaced by a custody integration when one is deployed. */
    @Bean
    @ConditionalOnMissingBean(ExternalSigner.class)
    public ExternalSigner externalSigner() {
        return new UnavailableExternalSigner();
    }
}
