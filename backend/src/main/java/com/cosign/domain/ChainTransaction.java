package com.cosign.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * On-chain transaction submitted on behalf of a multi-sig wallet (contract deployment or execution).
 */
@Document(collection = "chain_transactions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String walletId;
    private String pendingTransactionId;
    private ChainId chain;
    @Indexed
    private String txHash;
    private Kind kind;
    private String fromAddress;
    private String toAddress;
    private String amount;
    private Long blockNumber;
    private boolean success;
    private Instant recordedAt;

    public enum Kind {
        DEPLOYMENT,
        EXECUTION
    }
}
