package com.cosign.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for multisig_signers. Addresses passed in must already be normalized.
 */
public interface MultiSigSignerRepository extends MongoRepository<MultiSigSigner, String> {

    List<MultiSigSigner> findByWalletIdOrderByAddedAtAsc(String walletId);

    boolean existsByWalletIdAndAddress(String walletId, String address);

    long countByWalletId(String walletId);

    long deleteByWalletIdAndAddress(String walletId, String address);
}
