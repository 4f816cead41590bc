package com.cosign.multisig.execution;

import com.cosign.chain.ChainExecutionException;
import com.cosign.domain.ChainId;
import com.cosign.multisig.typed.TypedTransaction;

import java.math.BigInteger;

/**
 * Deploys Safe wallets and submits their aggregate-signature executions. Every failure, including a chain
 * without on-chain execution, is a {@link ChainExecutionException}.
 */
public interface OnChainExecutionAdapter {

    /** True when the chain is EVM, on-chain execution is enabled and a chain client is configured. */
    boolean supports(ChainId chain);

    /** Deploys through the proxy factory and waits for the configured confirmations. */
    DeploymentResult deploy(DeploymentRequest request);

    /** Typed transfer against the wallet's current on-chain nonce. */
    TypedTransaction buildTransaction(ChainId chain, String walletAddress, String recipient, BigInteger valueWei,
                                      String data);

    /**
     * Submits execTransaction with {@code packedSignatures} and waits for the configured confirmations.
     * A mined but reverted transaction fails with REVERTED.
     */
    ExecutionResult execute(ChainId chain, String walletAddress, TypedTransaction transaction, byte[] packedSignatures);
}
