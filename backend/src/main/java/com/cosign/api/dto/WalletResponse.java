package com.cosign.api.dto;

import com.cosign.domain.MultiSigSigner;
import com.cosign.domain.MultiSigWallet;
import com.cosign.multisig.service.WalletDetails;

import java.time.Instant;
import java.util.List;

public record WalletResponse(
        String id,
        String chain,
        String address,
        String addressSource,
        int threshold,
        int totalSigners,
        String label,
        String deploymentTxHash,
        Instant createdAt,
        List<SignerEntry> signers
) {

    public record SignerEntry(String address, String name, String email, Instant addedAt) {

        static SignerEntry from(MultiSigSigner s) {
            return new SignerEntry(s.getAddress(), s.getName(), s.getEmail(), s.getAddedAt());
        }
    }

    public static WalletResponse from(WalletDetails details) {
        return from(details.wallet(), details.signers().stream().map(SignerEntry::from).toList());
    }

    /** Wallet without its signer list (listing). */
    public static WalletResponse from(MultiSigWallet w) {
        return from(w, List.of());
    }

    private static WalletResponse from(MultiSigWallet w, List<SignerEntry> signers) {
        return new WalletResponse(
                w.getId(),
                w.getChain() != null ? w.getChain().name() : null,
                w.getAddress(),
                w.getAddressSource() != null ? w.getAddressSource().name() : null,
                w.getThreshold(),
                w.getTotalSigners(),
                w.getLabel(),
                w.getDeploymentTxHash(),
                w.getCreatedAt(),
                signers);
    }
}
