package com.cosign.multisig.execution;

/**
 * A mined, successful execTransaction.
 */
public record ExecutionResult(String txHash, long blockNumber, String from) {
}
