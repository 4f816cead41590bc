package com.cosign.multisig.typed;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Stable off-chain identifiers for wallets that are not deployed and transactions completed without a chain.
 * Placeholders are not contracts: nothing on any chain verifies them.
 */
@Component
public class DeterministicAddressFallback {

    /** Checksummed last 20 bytes of keccak256("multisig_" + walletId). */
    public String placeholderAddress(String walletId) {
        byte[] hash = Hash.sha3(("multisig_" + walletId).getBytes(StandardCharsets.UTF_8));
        return Keys.toChecksumAddress(Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32)));
    }

    /** 0x + keccak256("offchain_" + transactionId). */
    public String offChainExecutionHash(String transactionId) {
        return Numeric.toHexString(Hash.sha3(("offchain_" + transactionId).getBytes(StandardCharsets.UTF_8)));
    }
}
