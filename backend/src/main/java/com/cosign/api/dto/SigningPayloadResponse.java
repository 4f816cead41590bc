package com.cosign.api.dto;

import com.cosign.multisig.typed.TypedTransaction;

import java.util.Map;

/**
 * What each owner signs: the SafeTx hash, and the full typed data for eth_signTypedData_v4.
 */
public record SigningPayloadResponse(
        String transactionId,
        long chainId,
        String safeAddress,
        String nonce,
        String domainSeparator,
        String safeTxHash,
        Map<String, Object> typedData
) {

    public static SigningPayloadResponse from(String transactionId, TypedTransaction typed) {
        return new SigningPayloadResponse(
                transactionId,
                typed.chainId(),
                typed.verifyingContract(),
                typed.nonce().toString(),
                typed.domainSeparator(),
                typed.safeTxHash(),
                typed.toTypedData());
    }
}
