package com.cosign.multisig.typed;

import java.math.BigInteger;

/**
 * SafeTx message fields. Simple transfers use CALL with zero gas parameters and zero gas token/refund receiver.
 *
 * @param value wei
 * @param data  0x-prefixed call data, "0x" for a plain transfer
 */
public record SafeTransaction(String to, BigInteger value, String data, int operation, BigInteger safeTxGas,
                              BigInteger baseGas, BigInteger gasPrice, String gasToken, String refundReceiver,
                              BigInteger nonce) {

    public static final int OPERATION_CALL = 0;
    static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    public static SafeTransaction transfer(String to, BigInteger value, String data, BigInteger nonce) {
        return new SafeTransaction(to, value, data == null || data.isBlank() ? "0x" : data, OPERATION_CALL,
                BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, ZERO_ADDRESS, ZERO_ADDRESS, nonce);
    }
}
