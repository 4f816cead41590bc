package com.cosign.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional updates for pending_transactions.
 */
@Repository
@RequiredArgsConstructor
public class PendingTransactionRepositoryImpl implements PendingTransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<PendingTransaction> markExpiredIfOverdue(String id, Instant now, Instant claimStaleBefore) {
        Query query = new Query(where("_id").is(id)
                .and("status").is(PendingTransactionStatus.PENDING)
                .and("expiresAt").lt(now)
                .orOperator(
                        where("executionClaimedAt").is(null),
                        where("executionClaimedAt").lt(claimStaleBefore)));
        Update update = new Update()
                .set("status", PendingTransactionStatus.EXPIRED)
                .set("completedAt", now)
                .unset("executionClaimedAt")
                .inc("version", 1);
        PendingTransaction updated = mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), PendingTransaction.class);
        return Optional.ofNullable(updated);
    }
}
