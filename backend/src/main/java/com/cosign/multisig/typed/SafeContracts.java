package com.cosign.multisig.typed;

import com.cosign.chain.ChainLog;
import com.cosign.chain.ChainReceipt;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * ABI encoding for the Safe proxy factory and Safe singleton calls used here, and ProxyCreation log parsing.
 */
public final class SafeContracts {

    /** keccak256("ProxyCreation(address,address)"); proxy is indexed from v1.4.1, in data before that. */
    public static final String PROXY_CREATION_TOPIC = Hash.sha3String("ProxyCreation(address,address)");

    private static final String NONCE_SELECTOR = FunctionEncoder.encode(
            new Function("nonce", Collections.emptyList(), Collections.emptyList()));

    private SafeContracts() {
    }

    /** setup(owners, threshold, to=0, data=0x, fallbackHandler, paymentToken=0, payment=0, paymentReceiver=0). */
    public static String encodeSetup(List<String> owners, int threshold, String fallbackHandler) {
        List<Address> ownerAddresses = owners.stream().map(Address::new).toList();
        return FunctionEncoder.encode(new Function("setup", List.<Type>of(
                new DynamicArray<>(Address.class, ownerAddresses),
                new Uint256(BigInteger.valueOf(threshold)),
                new Address(SafeTransaction.ZERO_ADDRESS),
                new DynamicBytes(new byte[0]),
                new Address(fallbackHandler),
                new Address(SafeTransaction.ZERO_ADDRESS),
                new Uint256(BigInteger.ZERO),
                new Address(SafeTransaction.ZERO_ADDRESS)
        ), Collections.emptyList()));
    }

    public static String encodeCreateProxyWithNonce(String singleton, String initializer, BigInteger saltNonce) {
        return FunctionEncoder.encode(new Function("createProxyWithNonce", List.<Type>of(
                new Address(singleton),
                new DynamicBytes(Numeric.hexStringToByteArray(initializer)),
                new Uint256(saltNonce)
        ), Collections.emptyList()));
    }

    public static String encodeExecTransaction(SafeTransaction tx, byte[] packedSignatures) {
        return FunctionEncoder.encode(new Function("execTransaction", List.<Type>of(
                new Address(tx.to()),
                new Uint256(tx.value()),
                new DynamicBytes(Numeric.hexStringToByteArray(tx.data())),
                new Uint8(BigInteger.valueOf(tx.operation())),
                new Uint256(tx.safeTxGas()),
                new Uint256(tx.baseGas()),
                new Uint256(tx.gasPrice()),
                new Address(tx.gasToken()),
                new Address(tx.refundReceiver()),
                new DynamicBytes(packedSignatures)
        ), Collections.emptyList()));
    }

    public static String encodeNonce() {
        return NONCE_SELECTOR;
    }

    /** First 32-byte word of an eth_call result as uint256. Empty result ("0x") means no contract: nonce 0. */
    public static BigInteger decodeUint(String hex) {
        String clean = hex == null ? "" : Numeric.cleanHexPrefix(hex);
        if (clean.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(clean.substring(0, Math.min(64, clean.length())), 16);
    }

    /** uint256(keccak256("multisig_" + walletId)); stable per wallet so a retried deployment targets the same proxy. */
    public static BigInteger saltNonce(String walletId) {
        return Numeric.toBigInt(Hash.sha3(("multisig_" + walletId).getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Proxy address from the factory's ProxyCreation log in {@code receipt}, checksummed.
     */
    public static Optional<String> parseProxyAddress(ChainReceipt receipt, String factoryAddress) {
        for (ChainLog log : receipt.logs()) {
            if (log.topics().isEmpty() || !PROXY_CREATION_TOPIC.equalsIgnoreCase(log.topics().get(0))) {
                continue;
            }
            if (factoryAddress != null && log.address() != null && !factoryAddress.equalsIgnoreCase(log.address())) {
                continue;
            }
            String word = log.topics().size() > 1 ? log.topics().get(1) : firstWord(log.data());
            if (word != null) {
                String clean = Numeric.cleanHexPrefix(word);
                if (clean.length() >= 40) {
                    return Optional.of(Keys.toChecksumAddress(clean.substring(clean.length() - 40).toLowerCase(Locale.ROOT)));
                }
            }
        }
        return Optional.empty();
    }

    private static String firstWord(String data) {
        String clean = data == null ? "" : Numeric.cleanHexPrefix(data);
        return clean.length() >= 64 ? clean.substring(0, 64) : null;
    }
}
