package com.cosign.multisig.typed;

import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A SafeTx bound to one Safe on one chain, with the EIP-712 hash every owner signs.
 *
 * @param domainSeparator 0x-prefixed 32-byte hex
 * @param safeTxHash      0x-prefixed 32-byte hex; keccak256(0x1901 ‖ domainSeparator ‖ structHash)
 */
public record TypedTransaction(long chainId, String verifyingContract, SafeTransaction message,
                               String domainSeparator, String safeTxHash) {

    public BigInteger nonce() {
        return message.nonce();
    }

    public byte[] hashBytes() {
        return Numeric.hexStringToByteArray(safeTxHash);
    }

    /** eth_signTypedData_v4 payload for wallets that sign the structured form. */
    public Map<String, Object> toTypedData() {
        Map<String, Object> types = new LinkedHashMap<>();
        types.put("EIP712Domain", List.of(
                field("chainId", "uint256"),
                field("verifyingContract", "address")));
        types.put("SafeTx", List.of(
                field("to", "address"),
                field("value", "uint256"),
                field("data", "bytes"),
                field("operation", "uint8"),
                field("safeTxGas", "uint256"),
                field("baseGas", "uint256"),
                field("gasPrice", "uint256"),
                field("gasToken", "address"),
                field("refundReceiver", "address"),
                field("nonce", "uint256")));

        Map<String, Object> domain = new LinkedHashMap<>();
        domain.put("chainId", chainId);
        domain.put("verifyingContract", verifyingContract);

        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("to", message.to());
        msg.put("value", message.value().toString());
        msg.put("data", message.data());
        msg.put("operation", message.operation());
        msg.put("safeTxGas", message.safeTxGas().toString());
        msg.put("baseGas", message.baseGas().toString());
        msg.put("gasPrice", message.gasPrice().toString());
        msg.put("gasToken", message.gasToken());
        msg.put("refundReceiver", message.refundReceiver());
        msg.put("nonce", message.nonce().toString());

        Map<String, Object> typedData = new LinkedHashMap<>();
        typedData.put("types", types);
        typedData.put("primaryType", "SafeTx");
        typedData.put("domain", domain);
        typedData.put("message", msg);
        return typedData;
    }

    private static Map<String, String> field(String name, String type) {
        return Map.of("name", name, "type", type);
    }
}
