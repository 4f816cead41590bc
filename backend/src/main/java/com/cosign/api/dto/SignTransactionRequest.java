package com.cosign.api.dto;

import com.cosign.api.validation.ChainAddress;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/multisig/transactions/{id}/signatures. signature is optional 65-byte hex over the SafeTx hash.
 */
public record SignTransactionRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @ChainAddress
        String signer,

        String signature
) {
}
