package com.cosign.multisig.service;

import com.cosign.domain.MultiSigSigner;
import com.cosign.domain.MultiSigWallet;

import java.util.List;

/**
 * Wallet with its signers in the order they were added.
 */
public record WalletDetails(MultiSigWallet wallet, List<MultiSigSigner> signers) {

    public WalletDetails {
        signers = List.copyOf(signers);
    }
}
