package com.cosign.api.dto;

import com.cosign.api.validation.ChainAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * POST /api/v1/multisig/wallets/{id}/transactions. Amount is a decimal in the chain's native unit;
 * a memo starting with 0x is forwarded as call data.
 */
public record ProposeTransactionRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @ChainAddress
        String proposer,

        @NotBlank(message = "INVALID_ADDRESS")
        @ChainAddress
        String recipient,

        @NotBlank(message = "INVALID_AMOUNT")
        @Pattern(regexp = "^\\d+(\\.\\d+)?$", message = "INVALID_AMOUNT")
        String amount,

        String memo,

        String signature
) {
}
