package com.cosign.multisig.execution;

/**
 * A mined factory deployment.
 */
public record DeploymentResult(String address, String txHash, long blockNumber, String from, String factory) {
}
