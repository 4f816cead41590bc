package com.cosign.multisig.typed;

import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Concatenates owner signatures in ascending owner-address order, as Safe's checkNSignatures requires.
 * Each signature is r ‖ s ‖ v (65 bytes); v of 0/1 is lifted to 27/28.
 */
@Component
public class SignaturePacker {

    public static final int SIGNATURE_LENGTH = 65;

    public record SignerSignature(String signer, String signature) {
    }

    /**
     * @throws IllegalArgumentException when the list is empty, a signer repeats or a signature is malformed
     */
    public byte[] pack(List<SignerSignature> signatures) {
        if (signatures == null || signatures.isEmpty()) {
            throw new IllegalArgumentException("No signatures to pack");
        }
        List<SignerSignature> sorted = new ArrayList<>(signatures);
        sorted.sort(Comparator.comparing(s -> s.signer().toLowerCase(Locale.ROOT)));
        Set<String> seen = new HashSet<>();
        ByteArrayOutputStream out = new ByteArrayOutputStream(sorted.size() * SIGNATURE_LENGTH);
        for (SignerSignature s : sorted) {
            if (!seen.add(s.signer().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate signer " + s.signer());
            }
            byte[] bytes = toBytes(s.signature());
            out.writeBytes(bytes);
        }
        return out.toByteArray();
    }

    /** True when {@code signature} is 0x-prefixed or bare hex of exactly 65 bytes. */
    public static boolean isWellFormed(String signature) {
        if (signature == null) {
            return false;
        }
        String clean = Numeric.cleanHexPrefix(signature.trim());
        return clean.length() == SIGNATURE_LENGTH * 2 && clean.matches("[0-9a-fA-F]+");
    }

    private static byte[] toBytes(String signature) {
        if (!isWellFormed(signature)) {
            throw new IllegalArgumentException("Signature must be " + SIGNATURE_LENGTH + " bytes of hex");
        }
        byte[] bytes = Numeric.hexStringToByteArray(signature.trim());
        if (bytes[64] == 0 || bytes[64] == 1) {
            bytes[64] += 27;
        }
        return bytes;
    }
}
