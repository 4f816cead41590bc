package com.cosign.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Conditional updates for pending_transactions that cannot be expressed as derived queries.
 */
public interface PendingTransactionRepositoryCustom {

    /**
     * Atomically moves the record to EXPIRED if it is still PENDING, its expiry is before {@code now} and no
     * execution claim newer than {@code claimStaleBefore} is held on it.
     *
     * @return the updated record, or empty when the record was not eligible (already terminal, not overdue, missing)
     */
    Optional<PendingTransaction> markExpiredIfOverdue(String id, Instant now, Instant claimStaleBefore);
}
