package com.cosign.multisig.execution;

import com.cosign.domain.ChainId;
import com.cosign.multisig.typed.TypedTransaction;

import java.util.Optional;

/**
 * Signing collaborator that holds owner keys outside this service (custody service, HSM, remote wallet).
 */
public interface ExternalSigner {

    /**
     * @return 65-byte signature hex over {@link TypedTransaction#safeTxHash()}, or empty when this signer
     * cannot sign for {@code signer}
     */
    Optional<String> requestSignature(ChainId chain, String signer, TypedTransaction transaction);
}
