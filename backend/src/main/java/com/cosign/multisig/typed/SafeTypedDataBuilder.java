package com.cosign.multisig.typed;

import com.cosign.chain.ChainClient;
import com.cosign.chain.ContractCall;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Builds the EIP-712 SafeTx hash a Safe (v1.3.0+) verifies in execTransaction. Does not sign.
 */
@Component
public class SafeTypedDataBuilder {

    static final String DOMAIN_TYPE = "EIP712Domain(uint256 chainId,address verifyingContract)";
    static final String SAFE_TX_TYPE = "SafeTx(address to,uint256 value,bytes data,uint8 operation,uint256 safeTxGas,"
            + "uint256 baseGas,uint256 gasPrice,address gasToken,address refundReceiver,uint256 nonce)";

    public static final byte[] DOMAIN_SEPARATOR_TYPEHASH = Hash.sha3(DOMAIN_TYPE.getBytes(StandardCharsets.UTF_8));
    public static final byte[] SAFE_TX_TYPEHASH = Hash.sha3(SAFE_TX_TYPE.getBytes(StandardCharsets.UTF_8));

    /**
     * Reads the Safe's current nonce and builds the transfer against it.
     *
     * @param data call data; null or blank for a plain value transfer
     */
    public TypedTransaction build(ChainClient client, String safeAddress, String recipient, BigInteger value, String data) {
        BigInteger nonce = SafeContracts.decodeUint(client.call(ContractCall.of(safeAddress, SafeContracts.encodeNonce())));
        return build(client.chainId(), safeAddress, SafeTransaction.transfer(recipient, value, data, nonce));
    }

    public TypedTransaction build(long chainId, String safeAddress, SafeTransaction tx) {
        byte[] domainSeparator = domainSeparator(chainId, safeAddress);
        byte[] structHash = structHash(tx);
        byte[] digestInput = new byte[2 + domainSeparator.length + structHash.length];
        digestInput[0] = 0x19;
        digestInput[1] = 0x01;
        System.arraycopy(domainSeparator, 0, digestInput, 2, domainSeparator.length);
        System.arraycopy(structHash, 0, digestInput, 2 + domainSeparator.length, structHash.length);
        return new TypedTransaction(chainId, safeAddress, tx,
                Numeric.toHexString(domainSeparator), Numeric.toHexString(Hash.sha3(digestInput)));
    }

    static byte[] domainSeparator(long chainId, String safeAddress) {
        return hashTypes(
                new Bytes32(DOMAIN_SEPARATOR_TYPEHASH),
                new Uint256(BigInteger.valueOf(chainId)),
                new Address(safeAddress));
    }

    static byte[] structHash(SafeTransaction tx) {
        return hashTypes(
                new Bytes32(SAFE_TX_TYPEHASH),
                new Address(tx.to()),
                new Uint256(tx.value()),
                new Bytes32(Hash.sha3(Numeric.hexStringToByteArray(tx.data()))),
                new Uint8(BigInteger.valueOf(tx.operation())),
                new Uint256(tx.safeTxGas()),
                new Uint256(tx.baseGas()),
                new Uint256(tx.gasPrice()),
                new Address(tx.gasToken()),
                new Address(tx.refundReceiver()),
                new Uint256(tx.nonce()));
    }

    @SuppressWarnings("rawtypes")
    private static byte[] hashTypes(Type... types) {
        StringBuilder sb = new StringBuilder();
        for (Type type : types) {
            sb.append(TypeEncoder.encode(type));
        }
        return Hash.sha3(Numeric.hexStringToByteArray(sb.toString()));
    }
}
