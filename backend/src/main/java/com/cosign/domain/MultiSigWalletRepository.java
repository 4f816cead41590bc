package com.cosign.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for multisig_wallets.
 */
public interface MultiSigWalletRepository extends MongoRepository<MultiSigWallet, String> {

    List<MultiSigWallet> findByUserIdOrderByCreatedAtDesc(String userId);
}
