package com.cosign.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for chain_transactions.
 */
public interface ChainTransactionRepository extends MongoRepository<ChainTransaction, String> {

    List<ChainTransaction> findByWalletIdOrderByRecordedAtDesc(String walletId);
}
