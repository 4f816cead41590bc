package com.cosign.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for pending_transactions. Saves are versioned ({@link PendingTransaction#getVersion()}),
 * so a stale write fails with OptimisticLockingFailureException instead of overwriting.
 */
public interface PendingTransactionRepository extends MongoRepository<PendingTransaction, String>,
        PendingTransactionRepositoryCustom {

    /** Pending and not yet expired, newest first. */
    List<PendingTransaction> findByWalletIdAndStatusAndExpiresAtGreaterThanEqualOrderByCreatedAtDesc(
            String walletId, PendingTransactionStatus status, Instant now);

    List<PendingTransaction> findByStatusAndExpiresAtBefore(PendingTransactionStatus status, Instant cutoff);
}
