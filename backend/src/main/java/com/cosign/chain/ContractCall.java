package com.cosign.chain;

import java.math.BigInteger;

/**
 * A contract interaction: target, ABI-encoded call data, native value and optional gas limit.
 */
public record ContractCall(String to, String data, BigInteger value, BigInteger gasLimit) {

    public ContractCall {
        value = value != null ? value : BigInteger.ZERO;
    }

    public static ContractCall of(String to, String data) {
        return new ContractCall(to, data, BigInteger.ZERO, null);
    }

    public ContractCall withGasLimit(BigInteger limit) {
        return new ContractCall(to, data, value, limit);
    }
}
