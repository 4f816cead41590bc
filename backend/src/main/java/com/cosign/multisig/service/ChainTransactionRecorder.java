package com.cosign.multisig.service;

import com.cosign.domain.ChainTransaction;
import com.cosign.domain.ChainTransactionRepository;
import com.cosign.domain.MultiSigWallet;
import com.cosign.domain.PendingTransaction;
import com.cosign.multisig.execution.DeploymentResult;
import com.cosign.multisig.execution.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Keeps a chain_transactions row per mined deployment or execution. Best-effort: the transaction is already
 * on-chain, so a failed write is logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChainTransactionRecorder {

    private final ChainTransactionRepository chainTransactionRepository;

    public void recordDeployment(MultiSigWallet wallet, DeploymentResult result) {
        ChainTransaction row = new ChainTransaction();
        row.setWalletId(wallet.getId());
        row.setChain(wallet.getChain());
        row.setKind(ChainTransaction.Kind.DEPLOYMENT);
        row.setTxHash(result.txHash());
        row.setFromAddress(result.from());
        row.setToAddress(result.factory());
        row.setAmount("0");
        row.setBlockNumber(result.blockNumber());
        row.setSuccess(true);
        save(row);
    }

    public void recordExecution(MultiSigWallet wallet, PendingTransaction tx, ExecutionResult result) {
        ChainTransaction row = new ChainTransaction();
        row.setWalletId(wallet.getId());
        row.setPendingTransactionId(tx.getId());
        row.setChain(wallet.getChain());
        row.setKind(ChainTransaction.Kind.EXECUTION);
        row.setTxHash(result.txHash());
        row.setFromAddress(result.from());
        row.setToAddress(tx.getRecipient());
        row.setAmount(tx.getAmount());
        row.setBlockNumber(result.blockNumber());
        row.setSuccess(true);
        save(row);
    }

    private void save(ChainTransaction row) {
        row.setRecordedAt(Instant.now());
        try {
            chainTransactionRepository.save(row);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} transaction {} for wallet {}: {}", row.getKind(), row.getTxHash(), row.getWalletId(), e.getMessage());
        }
    }
}
