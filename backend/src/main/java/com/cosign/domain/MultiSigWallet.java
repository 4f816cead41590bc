package com.cosign.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Group-controlled wallet requiring {@code threshold} of {@code totalSigners} approvals.
 * Address is set once: the deployed contract address, or the deterministic placeholder when deployment
 * is unavailable. Threshold never changes after creation; totalSigners follows add/remove-signer.
 */
@Document(collection = "multisig_wallets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MultiSigWallet {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private ChainId chain;
    private String address;
    private AddressSource addressSource;
    private int threshold;
    private int totalSigners;
    @Indexed
    private String userId;
    private String label;
    private String deploymentTxHash;
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    /** True when {@link #address} is a real contract that can verify signatures on-chain. */
    public boolean isDeployed() {
        return addressSource == AddressSource.DEPLOYED && address != null;
    }

    public enum AddressSource {
        /** Record created, deployment not yet resolved. */
        PENDING,
        /** Off-chain placeholder derived from the wallet id. */
        PLACEHOLDER,
        /** Address parsed from the factory deployment receipt. */
        DEPLOYED
    }
}
