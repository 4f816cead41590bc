package com.cosign.api.dto;

import com.cosign.api.validation.ChainAddress;
import jakarta.validation.constraints.NotBlank;

/**
 * Cancel and retry requests: the acting signer.
 */
public record SignerActionRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @ChainAddress
        String signer
) {
}
