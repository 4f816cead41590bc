package com.cosign.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Proposed transfer collecting signatures until {@code requiredSignatures} is reached.
 * currentSignatures always equals signedBy.size(); signedBy holds normalized, unique addresses in signing order.
 * {@link #version} makes every save a conditional update.
 */
@Document(collection = "pending_transactions")
@CompoundIndexes({
        @CompoundIndex(name = "wallet_status_created", def = "{'walletId': 1, 'status': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "status_expires", def = "{'status': 1, 'expiresAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PendingTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private ChainId chain;
    private String recipient;
    /** Decimal string in the chain's native unit (e.g. ether). */
    private String amount;
    /** Free text, or 0x-prefixed call data forwarded to the contract. */
    private String memo;
    private int requiredSignatures;
    private int currentSignatures;
    private List<String> signedBy = new ArrayList<>();
    /** Normalized signer → 65-byte signature hex, for signers that supplied one. */
    private Map<String, String> signatures = new LinkedHashMap<>();
    private String proposer;
    private PendingTransactionStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant completedAt;
    private String executionTxHash;
    private ExecutionMode executionMode;
    /** Set by the writer that crossed the threshold; cleared when its execution attempt fails. */
    private Instant executionClaimedAt;
    private int executionAttempts;
    private String lastExecutionError;
    private String cancelledBy;
    @Version
    private Long version;

    public void setSignedBy(List<String> signedBy) {
        this.signedBy = signedBy != null ? signedBy : new ArrayList<>();
    }

    public void setSignatures(Map<String, String> signatures) {
        this.signatures = signatures != null ? signatures : new LinkedHashMap<>();
    }

    public boolean isThresholdMet() {
        return currentSignatures >= requiredSignatures;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public enum ExecutionMode {
        ON_CHAIN,
        OFF_CHAIN
    }
}
