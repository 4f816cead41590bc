package com.cosign.api.dto;

import com.cosign.domain.PendingTransaction;

import java.time.Instant;
import java.util.List;

/**
 * Pending transaction as returned by the API. Collected signatures are not echoed back.
 */
public record PendingTransactionResponse(
        String id,
        String walletId,
        String chain,
        String recipient,
        String amount,
        String memo,
        int requiredSignatures,
        int currentSignatures,
        List<String> signedBy,
        String proposer,
        String status,
        Instant createdAt,
        Instant expiresAt,
        Instant completedAt,
        String executionTxHash,
        String executionMode,
        int executionAttempts,
        String lastExecutionError,
        String cancelledBy
) {

    public static PendingTransactionResponse from(PendingTransaction t) {
        return new PendingTransactionResponse(
                t.getId(),
                t.getWalletId(),
                t.getChain() != null ? t.getChain().name() : null,
                t.getRecipient(),
                t.getAmount(),
                t.getMemo(),
                t.getRequiredSignatures(),
                t.getCurrentSignatures(),
                List.copyOf(t.getSignedBy()),
                t.getProposer(),
                t.getStatus() != null ? t.getStatus().name() : null,
                t.getCreatedAt(),
                t.getExpiresAt(),
                t.getCompletedAt(),
                t.getExecutionTxHash(),
                t.getExecutionMode() != null ? t.getExecutionMode().name() : null,
                t.getExecutionAttempts(),
                t.getLastExecutionError(),
                t.getCancelledBy());
    }
}
