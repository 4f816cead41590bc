package com.cosign.domain;

/**
 * Lifecycle of a {@link PendingTransaction}. Every state other than PENDING is terminal.
 */
public enum PendingTransactionStatus {
    PENDING,
    EXECUTED,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
