package com.cosign.api.dto;

import com.cosign.api.validation.ChainAddress;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Signer entry in create-wallet and add-signer requests.
 */
public record SignerRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @ChainAddress
        String address,

        String name,

        @Email
        String email
) {
}
