package com.cosign.multisig.quorum;

import com.cosign.domain.MultiSigWallet;
import com.cosign.domain.PendingTransaction;
import com.cosign.domain.PendingTransactionStatus;
import com.cosign.multisig.MultiSigErrorCode;
import com.cosign.multisig.MultiSigException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Pending → {Executed, Cancelled, Expired}. Pure transitions over an in-memory record; the caller
 * persists and serializes them per transaction. Checks never mutate the record.
 */
@Component
public class QuorumStateMachine {

    /**
     * New proposal already signed by the proposer.
     *
     * @param signature proposer's signature over the typed hash, or null
     */
    public PendingTransaction newProposal(MultiSigWallet wallet, String proposer, String recipient, String amount,
                                          String memo, String signature, Instant now, Duration ttl) {
        PendingTransaction tx = new PendingTransaction();
        tx.setWalletId(wallet.getId());
        tx.setChain(wallet.getChain());
        tx.setRecipient(recipient);
        tx.setAmount(amount);
        tx.setMemo(memo);
        tx.setRequiredSignatures(wallet.getThreshold());
        tx.setProposer(proposer);
        tx.setStatus(PendingTransactionStatus.PENDING);
        tx.setCreatedAt(now);
        tx.setExpiresAt(now.plus(ttl));
        appendSignature(tx, proposer, signature);
        return tx;
    }

    /**
     * Preconditions of sign, in order: NOT_PENDING, EXPIRED, ALREADY_SIGNED, UNAUTHORIZED.
     * A pending record past its expiry must be moved to EXPIRED by the caller.
     */
    public void checkCanSign(PendingTransaction tx, String signer, Collection<String> currentSigners, Instant now) {
        requirePending(tx);
        if (tx.isExpiredAt(now)) {
            throw new MultiSigException(MultiSigErrorCode.EXPIRED, "Transaction " + tx.getId() + " expired at " + tx.getExpiresAt());
        }
        if (tx.getSignedBy().contains(signer)) {
            throw new MultiSigException(MultiSigErrorCode.ALREADY_SIGNED, signer + " already signed " + tx.getId());
        }
        requireSigner(tx, signer, currentSigners);
    }

    /** Cancel needs one current signer and a pending record with no execution in flight. */
    public void checkCanCancel(PendingTransaction tx, String canceller, Collection<String> currentSigners, Instant now,
                               Duration claimTtl) {
        requirePending(tx);
        requireSigner(tx, canceller, currentSigners);
        if (hasLiveClaim(tx, now, claimTtl)) {
            throw new MultiSigException(MultiSigErrorCode.EXECUTION_IN_PROGRESS, "Transaction " + tx.getId() + " is being executed");
        }
    }

    public void checkCanRetry(PendingTransaction tx, String requester, Collection<String> currentSigners, Instant now,
                              Duration claimTtl) {
        requirePending(tx);
        requireSigner(tx, requester, currentSigners);
        if (!tx.isThresholdMet()) {
            throw new MultiSigException(MultiSigErrorCode.THRESHOLD_NOT_MET,
                    tx.getCurrentSignatures() + " of " + tx.getRequiredSignatures() + " signatures on " + tx.getId());
        }
        if (hasLiveClaim(tx, now, claimTtl)) {
            throw new MultiSigException(MultiSigErrorCode.EXECUTION_IN_PROGRESS, "Transaction " + tx.getId() + " is being executed");
        }
    }

    /** Appends {@code signer}; keeps currentSignatures equal to signedBy.size(). */
    public void appendSignature(PendingTransaction tx, String signer, String signature) {
        List<String> signedBy = new ArrayList<>(tx.getSignedBy());
        signedBy.add(signer);
        tx.setSignedBy(signedBy);
        tx.setCurrentSignatures(signedBy.size());
        if (signature != null) {
            tx.getSignatures().put(signer, signature);
        }
    }

    /**
     * Takes the execution claim when the threshold is met and no live claim exists. Only the writer whose
     * versioned save carries the claim may execute.
     *
     * @return true when this call took the claim
     */
    public boolean claimExecution(PendingTransaction tx, Instant now, Duration claimTtl) {
        if (tx.getStatus() != PendingTransactionStatus.PENDING || !tx.isThresholdMet() || hasLiveClaim(tx, now, claimTtl)) {
            return false;
        }
        tx.setExecutionClaimedAt(now);
        tx.setExecutionAttempts(tx.getExecutionAttempts() + 1);
        return true;
    }

    public void markExecuted(PendingTransaction tx, String executionTxHash, PendingTransaction.ExecutionMode mode, Instant now) {
        tx.setStatus(PendingTransactionStatus.EXECUTED);
        tx.setExecutionTxHash(executionTxHash);
        tx.setExecutionMode(mode);
        tx.setCompletedAt(now);
        tx.setExecutionClaimedAt(null);
        tx.setLastExecutionError(null);
    }

    /** Failed execution: stays pending with every collected signature. */
    public void releaseClaim(PendingTransaction tx, String error) {
        tx.setExecutionClaimedAt(null);
        tx.setLastExecutionError(error);
    }

    public void markCancelled(PendingTransaction tx, String canceller, Instant now) {
        tx.setStatus(PendingTransactionStatus.CANCELLED);
        tx.setCancelledBy(canceller);
        tx.setCompletedAt(now);
    }

    public boolean hasLiveClaim(PendingTransaction tx, Instant now, Duration claimTtl) {
        Instant claimedAt = tx.getExecutionClaimedAt();
        return claimedAt != null && now.isBefore(claimedAt.plus(claimTtl));
    }

    private static void requirePending(PendingTransaction tx) {
        if (tx.getStatus() != PendingTransactionStatus.PENDING) {
            throw new MultiSigException(MultiSigErrorCode.NOT_PENDING, "Transaction " + tx.getId() + " is " + tx.getStatus());
        }
    }

    private static void requireSigner(PendingTransaction tx, String address, Collection<String> currentSigners) {
        if (!currentSigners.contains(address)) {
            throw new MultiSigException(MultiSigErrorCode.UNAUTHORIZED,
                    address + " is not a signer of wallet " + tx.getWalletId());
        }
    }
}
