package com.cosign.api.dto;

import com.cosign.domain.ChainId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * POST /api/v1/multisig/wallets. threshold &le; signers.size() is checked by the service.
 */
public record CreateWalletRequest(
        @NotNull(message = "INVALID_CHAIN")
        ChainId chain,

        @NotEmpty(message = "THRESHOLD_INVARIANT_VIOLATED")
        List<@Valid SignerRequest> signers,

        @Min(value = 1, message = "THRESHOLD_INVARIANT_VIOLATED")
        int threshold,

        String label
) {
}
