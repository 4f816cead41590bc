package com.cosign.multisig.execution;

import com.cosign.chain.ChainClient;
import com.cosign.chain.ChainClientRegistry;
import com.cosign.chain.ChainExecutionException;
import com.cosign.chain.ChainReceipt;
import com.cosign.chain.ContractCall;
import com.cosign.chain.ExecutionFailureReason;
import com.cosign.chain.RpcException;
import com.cosign.chain.config.ChainProperties;
import com.cosign.domain.ChainId;
import com.cosign.multisig.typed.SafeContracts;
import com.cosign.multisig.typed.SafeTypedDataBuilder;
import com.cosign.multisig.typed.TypedTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * {@link OnChainExecutionAdapter} for Safe v1.3.0+ contracts on EVM chains, submitting through the chain's
 * relayer account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SafeOnChainExecutionAdapter implements OnChainExecutionAdapter {

    private final ChainProperties chainProperties;
    private final ChainClientRegistry chainClientRegistry;
    private final SafeTypedDataBuilder typedDataBuilder;

    @Override
    public boolean supports(ChainId chain) {
        return chain != null && chainProperties.isOnChainEnabled(chain) && chainClientRegistry.supports(chain);
    }

    @Override
    public DeploymentResult deploy(DeploymentRequest request) {
        ChainClient client = clientFor(request.chain());
        ChainProperties.NetworkEntry entry = chainProperties.entry(request.chain());
        String initializer = SafeContracts.encodeSetup(request.owners(), request.threshold(), entry.getFallbackHandler());
        String data = SafeContracts.encodeCreateProxyWithNonce(
                entry.getSingletonAddress(), initializer, SafeContracts.saltNonce(request.walletId()));
        ContractCall call = ContractCall.of(entry.getFactoryAddress(), data);

        ChainReceipt receipt = submitAndWait(client, call, entry, "deployment of wallet " + request.walletId());
        String proxy = SafeContracts.parseProxyAddress(receipt, entry.getFactoryAddress())
                .orElseThrow(() -> new ChainExecutionException(ExecutionFailureReason.MALFORMED_RECEIPT,
                        "No ProxyCreation event in " + receipt.transactionHash()));
        log.info("Deployed Safe {} for wallet {} on {} in {}", proxy, request.walletId(), request.chain(), receipt.transactionHash());
        return new DeploymentResult(proxy, receipt.transactionHash(), receipt.blockNumber(), receipt.from(), entry.getFactoryAddress());
    }

    @Override
    public TypedTransaction buildTransaction(ChainId chain, String walletAddress, String recipient, BigInteger valueWei,
                                             String data) {
        ChainClient client = clientFor(chain);
        try {
            return typedDataBuilder.build(client, walletAddress, recipient, valueWei, data);
        } catch (RpcException e) {
            throw ChainExecutionException.from("nonce lookup for " + walletAddress, e);
        }
    }

    @Override
    public ExecutionResult execute(ChainId chain, String walletAddress, TypedTransaction transaction, byte[] packedSignatures) {
        ChainClient client = clientFor(chain);
        ChainProperties.NetworkEntry entry = chainProperties.entry(chain);
        String data = SafeContracts.encodeExecTransaction(transaction.message(), packedSignatures);
        ChainReceipt receipt = submitAndWait(client, ContractCall.of(walletAddress, data), entry,
                "execution " + transaction.safeTxHash());
        return new ExecutionResult(receipt.transactionHash(), receipt.blockNumber(), receipt.from());
    }

    private ChainReceipt submitAndWait(ChainClient client, ContractCall call, ChainProperties.NetworkEntry entry, String what) {
        ContractCall withGas = call.withGasLimit(gasLimit(client, call, entry));
        String txHash = client.submit(withGas);
        ChainReceipt receipt = client.waitForReceipt(txHash, entry.getConfirmations(), chainProperties.getReceiptTimeout());
        if (!receipt.success()) {
            throw new ChainExecutionException(ExecutionFailureReason.REVERTED, what + " reverted in " + txHash);
        }
        return receipt;
    }

    /** Estimate when the node can; a revert during estimation fails early, anything else uses the configured limit. */
    private BigInteger gasLimit(ChainClient client, ContractCall call, ChainProperties.NetworkEntry entry) {
        try {
            return client.estimateGas(call);
        } catch (RpcException e) {
            ChainExecutionException classified = ChainExecutionException.from("eth_estimateGas", e);
            if (classified.getReason() == ExecutionFailureReason.REVERTED
                    || classified.getReason() == ExecutionFailureReason.INSUFFICIENT_FUNDS) {
                throw classified;
            }
            log.warn("Gas estimation failed on {}, using limit {}: {}", client.chain(), entry.getExecGasLimit(), e.getMessage());
            return entry.getExecGasLimit();
        }
    }

    private ChainClient clientFor(ChainId chain) {
        if (!supports(chain)) {
            throw new ChainExecutionException(ExecutionFailureReason.UNSUPPORTED_CHAIN,
                    "On-chain execution not available for " + chain);
        }
        return chainClientRegistry.find(chain)
                .orElseThrow(() -> new ChainExecutionException(ExecutionFailureReason.UNSUPPORTED_CHAIN,
                        "No chain client for " + chain));
    }
}
