package com.cosign.multisig.service;

/**
 * Signer to add to a wallet; name and email are optional.
 */
public record SignerSpec(String address, String name, String email) {

    public static SignerSpec of(String address) {
        return new SignerSpec(address, null, null);
    }
}
