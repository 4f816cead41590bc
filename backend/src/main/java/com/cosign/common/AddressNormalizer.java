package com.cosign.common;

import org.web3j.crypto.Keys;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes chain addresses so that equality and membership checks compare one representation.
 * EVM: EIP-55 checksum; mixed-case input must already carry a valid checksum. Solana: trimmed Base58.
 */
public final class AddressNormalizer {

    private static final Pattern EVM_HEX = Pattern.compile("^[0-9a-fA-F]{40}$");
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    private AddressNormalizer() {
    }

    /**
     * @return canonical form of {@code address}
     * @throws InvalidAddressException if the address is null, blank or malformed for the format
     */
    public static String normalize(String address, AddressFormat format) {
        if (address == null || address.isBlank()) {
            throw new InvalidAddressException("Address is required");
        }
        String trimmed = address.trim();
        return switch (format) {
            case EVM -> normalizeEvm(trimmed);
            case SOLANA -> normalizeSolana(trimmed);
        };
    }

    public static boolean isValid(String address, AddressFormat format) {
        try {
            normalize(address, format);
            return true;
        } catch (InvalidAddressException e) {
            return false;
        }
    }

    private static String normalizeEvm(String address) {
        String hex = address.startsWith("0x") || address.startsWith("0X") ? address.substring(2) : address;
        if (!EVM_HEX.matcher(hex).matches()) {
            throw new InvalidAddressException("Invalid EVM address: " + address);
        }
        String checksummed = Keys.toChecksumAddress(hex.toLowerCase(Locale.ROOT));
        boolean mixedCase = !hex.equals(hex.toLowerCase(Locale.ROOT)) && !hex.equals(hex.toUpperCase(Locale.ROOT));
        if (mixedCase && !checksummed.substring(2).equals(hex)) {
            throw new InvalidAddressException("Bad EIP-55 checksum: " + address);
        }
        return checksummed;
    }

    private static String normalizeSolana(String address) {
        if (!SOLANA_ADDRESS.matcher(address).matches()) {
            throw new InvalidAddressException("Invalid Solana address: " + address);
        }
        return address;
    }
}
