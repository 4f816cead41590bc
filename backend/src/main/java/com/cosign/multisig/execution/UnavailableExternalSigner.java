package com.cosign.multisig.execution;

import com.cosign.domain.ChainId;
import com.cosign.multisig.typed.TypedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Default {@link ExternalSigner}: no key material, never signs. Signers must supply signatures themselves.
 */
@Slf4j
public class UnavailableExternalSigner implements ExternalSigner {

    @Override
    public Optional<String> requestSignature(ChainId chain, String signer, TypedTransaction transaction) {
        log.debug("No external signer configured; cannot sign {} for {} on {}", transaction.safeTxHash(), signer, chain);
        return Optional.empty();
    }
}
