package com.cosign.multisig.audit;

/**
 * Audit action names, one per state-changing operation.
 */
public final class MultiSigAuditActions {

    public static final String WALLET_CREATED = "multisig_wallet_created";
    public static final String SIGNER_ADDED = "multisig_signer_added";
    public static final String SIGNER_REMOVED = "multisig_signer_removed";
    public static final String TRANSACTION_PROPOSED = "multisig_transaction_proposed";
    public static final String TRANSACTION_SIGNED = "multisig_transaction_signed";
    public static final String TRANSACTION_EXECUTED = "multisig_transaction_executed";
    public static final String EXECUTION_FAILED = "multisig_execution_failed";
    public static final String TRANSACTION_CANCELLED = "multisig_transaction_cancelled";
    public static final String TRANSACTION_EXPIRED = "multisig_transaction_expired";

    public static final String RESOURCE_WALLET = "multisig_wallet";
    public static final String RESOURCE_TRANSACTION = "multisig_transaction";

    private MultiSigAuditActions() {
    }
}
