package com.cosign.multisig.service;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Multi-sig lifecycle settings (cosign.multisig).
 */
@ConfigurationProperties(prefix = "cosign.multisig")
@NoArgsConstructor
@Getter
@Setter
public class MultiSigProperties {

    /** Lifetime of a proposal; signing after it fails with EXPIRED. */
    private Duration proposalTtl = Duration.ofDays(7);
    /** Execution claims older than this are abandoned and may be taken over by a retry. */
    private Duration executionClaimTtl = Duration.ofMinutes(10);
    /** Reload-and-revalidate attempts when a versioned save loses a race. */
    private int maxUpdateAttempts = 5;
}
