package com.cosign.multisig.service;

import com.cosign.chain.ChainExecutionException;
import com.cosign.chain.ExecutionFailureReason;
import com.cosign.common.AddressNormalizer;
import com.cosign.common.InvalidAddressException;
import com.cosign.common.KeyedLocks;
import com.cosign.domain.ChainId;
import com.cosign.domain.MultiSigAuditEvent;
import com.cosign.domain.MultiSigSigner;
import com.cosign.domain.MultiSigSignerRepository;
import com.cosign.domain.MultiSigWallet;
import com.cosign.domain.MultiSigWalletRepository;
import com.cosign.domain.PendingTransaction;
import com.cosign.domain.PendingTransactionRepository;
import com.cosign.domain.PendingTransactionStatus;
import com.cosign.multisig.MultiSigErrorCode;
import com.cosign.multisig.MultiSigException;
import com.cosign.multisig.audit.MultiSigAuditActions;
import com.cosign.multisig.execution.DeploymentRequest;
import com.cosign.multisig.execution.DeploymentResult;
import com.cosign.multisig.execution.ExecutionResult;
import com.cosign.multisig.execution.ExternalSigner;
import com.cosign.multisig.execution.OnChainExecutionAdapter;
import com.cosign.multisig.quorum.QuorumStateMachine;
import com.cosign.multisig.typed.DeterministicAddressFallback;
import com.cosign.multisig.typed.SignaturePacker;
import com.cosign.multisig.typed.TypedTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Multi-sig wallet lifecycle: wallet creation with deployment or placeholder fallback, signer management,
 * and proposal → signatures → execution with lazy expiry.
 * <p>
 * Mutations of one pending transaction are serialized by a per-id lock inside this process and by versioned
 * saves across processes. The save that records the threshold-crossing signature also takes the execution
 * claim; only that caller executes, and the EXECUTED status is written last.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MultiSigService {

    private static final int WEI_DECIMALS = 18;

    private final MultiSigWalletRepository walletRepository;
    private final MultiSigSignerRepository signerRepository;
    private final PendingTransactionRepository pendingTransactionRepository;
    private final QuorumStateMachine quorum;
    private final OnChainExecutionAdapter executionAdapter;
    private final ExternalSigner externalSigner;
    private final SignaturePacker signaturePacker;
    private final DeterministicAddressFallback addressFallback;
    private final ChainTransactionRecorder chainTransactionRecorder;
    private final KeyedLocks keyedLocks;
    private final MultiSigProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Creates a t-of-n wallet. Deploys a Safe when the chain supports on-chain execution; otherwise, or when
     * deployment fails, the wallet gets its deterministic placeholder address. Never fails after validation.
     *
     * @throws MultiSigException INVALID_ADDRESS, DUPLICATE_SIGNER, THRESHOLD_INVARIANT_VIOLATED
     */
    public WalletDetails createWallet(String userId, ChainId chain, List<SignerSpec> signers, int threshold, String label) {
        Objects.requireNonNull(chain, "chain");
        List<SignerSpec> normalized = normalizeSigners(chain, signers);
        if (threshold < 1 || threshold > normalized.size()) {
            throw new MultiSigException(MultiSigErrorCode.THRESHOLD_INVARIANT_VIOLATED,
                    "Threshold " + threshold + " must be between 1 and " + normalized.size());
        }
        Instant now = Instant.now();
        MultiSigWallet wallet = new MultiSigWallet();
        wallet.setChain(chain);
        wallet.setThreshold(threshold);
        wallet.setTotalSigners(normalized.size());
        wallet.setUserId(userId);
        wallet.setLabel(label != null && !label.isBlank() ? label.trim() : "MultiSig " + threshold + "/" + normalized.size());
        wallet.setAddressSource(MultiSigWallet.AddressSource.PENDING);
        wallet.setCreatedAt(now);
        wallet.setUpdatedAt(now);
        wallet = walletRepository.save(wallet);

        List<MultiSigSigner> saved = new ArrayList<>();
        for (SignerSpec spec : normalized) {
            saved.add(signerRepository.save(newSigner(wallet.getId(), spec, now)));
        }

        List<String> owners = normalized.stream().map(SignerSpec::address).toList();
        resolveAddress(wallet, owners);
        wallet.setUpdatedAt(Instant.now());
        wallet = walletRepository.save(wallet);

        log.info("Created {}-of-{} wallet {} on {} at {} ({})", threshold, owners.size(), wallet.getId(), chain,
                wallet.getAddress(), wallet.getAddressSource());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("chain", chain.name());
        metadata.put("address", wallet.getAddress());
        metadata.put("addressSource", wallet.getAddressSource().name());
        metadata.put("threshold", threshold);
        metadata.put("signers", owners);
        audit(MultiSigAuditActions.WALLET_CREATED, userId, MultiSigAuditActions.RESOURCE_WALLET, wallet.getId(), metadata);
        return new WalletDetails(wallet, saved);
    }

    /**
     * @throws MultiSigException NOT_FOUND, UNAUTHORIZED (not the wallet owner), INVALID_ADDRESS, DUPLICATE_SIGNER
     */
    public WalletDetails addSigner(String walletId, String userId, SignerSpec signer) {
        return keyedLocks.withLock(walletKey(walletId), () -> {
            MultiSigWallet wallet = loadWallet(walletId);
            requireOwner(wallet, userId);
            String address = normalize(signer.address(), wallet.getChain());
            if (signerRepository.existsByWalletIdAndAddress(walletId, address)) {
                throw new MultiSigException(MultiSigErrorCode.DUPLICATE_SIGNER, address + " is already a signer of " + walletId);
            }
            try {
                signerRepository.save(newSigner(walletId, new SignerSpec(address, signer.name(), signer.email()), Instant.now()));
            } catch (DuplicateKeyException e) {
                throw new MultiSigException(MultiSigErrorCode.DUPLICATE_SIGNER, address + " is already a signer of " + walletId);
            }
            MultiSigWallet updated = refreshSignerCount(wallet);
            log.info("Added signer {} to wallet {} ({} signers)", address, walletId, updated.getTotalSigners());
            audit(MultiSigAuditActions.SIGNER_ADDED, userId, MultiSigAuditActions.RESOURCE_WALLET, walletId,
                    Map.of("signer", address, "totalSigners", updated.getTotalSigners()));
            return new WalletDetails(updated, signerRepository.findByWalletIdOrderByAddedAtAsc(walletId));
        });
    }

    /**
     * Removes a signer. Pending transactions keep their required-signature snapshot and collected signatures.
     *
     * @throws MultiSigException NOT_FOUND, UNAUTHORIZED, INVALID_ADDRESS, THRESHOLD_INVARIANT_VIOLATED
     */
    public WalletDetails removeSigner(String walletId, String userId, String signerAddress) {
        return keyedLocks.withLock(walletKey(walletId), () -> {
            MultiSigWallet wallet = loadWallet(walletId);
            requireOwner(wallet, userId);
            String address = normalize(signerAddress, wallet.getChain());
            if (!signerRepository.existsByWalletIdAndAddress(walletId, address)) {
                throw MultiSigException.notFound("Signer", address);
            }
            long remaining = signerRepository.countByWalletId(walletId) - 1;
            if (remaining < wallet.getThreshold()) {
                throw new MultiSigException(MultiSigErrorCode.THRESHOLD_INVARIANT_VIOLATED,
                        "Removing " + address + " leaves " + remaining + " signers for threshold " + wallet.getThreshold());
            }
            signerRepository.deleteByWalletIdAndAddress(walletId, address);
            MultiSigWallet updated = refreshSignerCount(wallet);
            log.info("Removed signer {} from wallet {} ({} signers)", address, walletId, updated.getTotalSigners());
            audit(MultiSigAuditActions.SIGNER_REMOVED, userId, MultiSigAuditActions.RESOURCE_WALLET, walletId,
                    Map.of("signer", address, "totalSigners", updated.getTotalSigners()));
            return new WalletDetails(updated, signerRepository.findByWalletIdOrderByAddedAtAsc(walletId));
        });
    }

    public WalletDetails getWallet(String walletId) {
        MultiSigWallet wallet = loadWallet(walletId);
        return new WalletDetails(wallet, signerRepository.findByWalletIdOrderByAddedAtAsc(walletId));
    }

    public List<MultiSigWallet> listWallets(String userId) {
        return walletRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Proposes a transfer signed by the proposer. A 1-of-n wallet executes immediately.
     *
     * @param amount    decimal in the chain's native unit
     * @param memo      free text, or 0x-prefixed call data for the recipient
     * @param signature proposer's 65-byte signature over the typed hash, or null
     * @throws MultiSigException NOT_FOUND, INVALID_ADDRESS, INVALID_AMOUNT, INVALID_SIGNATURE, UNAUTHORIZED
     */
    public PendingTransaction propose(String walletId, String proposerAddress, String recipient, String amount,
                                      String memo, String signature) {
        MultiSigWallet wallet = loadWallet(walletId);
        String proposer = normalize(proposerAddress, wallet.getChain());
        String to = normalize(recipient, wallet.getChain());
        String normalizedAmount = validateAmount(amount);
        String sig = validateSignature(signature);
        if (!currentSigners(walletId).contains(proposer)) {
            throw new MultiSigException(MultiSigErrorCode.UNAUTHORIZED, proposer + " is not a signer of wallet " + walletId);
        }
        Instant now = Instant.now();
        PendingTransaction tx = quorum.newProposal(wallet, proposer, to, normalizedAmount, memo, sig, now, properties.getProposalTtl());
        boolean claimed = quorum.claimExecution(tx, now, properties.getExecutionClaimTtl());
        PendingTransaction saved = pendingTransactionRepository.save(tx);
        log.info("Proposed transaction {} on wallet {}: {} to {} ({}/{} signatures)", saved.getId(), walletId,
                normalizedAmount, to, saved.getCurrentSignatures(), saved.getRequiredSignatures());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("walletId", walletId);
        metadata.put("recipient", to);
        metadata.put("amount", normalizedAmount);
        metadata.put("requiredSignatures", saved.getRequiredSignatures());
        audit(MultiSigAuditActions.TRANSACTION_PROPOSED, proposer, MultiSigAuditActions.RESOURCE_TRANSACTION, saved.getId(), metadata);
        if (!claimed) {
            return saved;
        }
        return keyedLocks.withLock(transactionKey(saved.getId()), () -> executeClaimed(wallet, saved, proposer).transaction());
    }

    /**
     * Adds a signature. The signature that reaches the threshold triggers execution; an execution failure
     * leaves the transaction pending with the signature kept (see {@link PendingTransaction#getLastExecutionError()}).
     *
     * @param signature 65-byte signature over the typed hash, or null to have it requested at execution time
     * @throws MultiSigException NOT_FOUND, NOT_PENDING, EXPIRED, ALREADY_SIGNED, UNAUTHORIZED, INVALID_ADDRESS,
     *                           INVALID_SIGNATURE, CONCURRENT_UPDATE
     */
    public PendingTransaction sign(String transactionId, String signerAddress, String signature) {
        String sig = validateSignature(signature);
        return keyedLocks.withLock(transactionKey(transactionId), () -> {
            Signed signed = updateWithRetry(transactionId, tx -> {
                Instant now = Instant.now();
                String signer = normalize(signerAddress, tx.getChain());
                expireIfOverdue(tx, now, signer);
                quorum.checkCanSign(tx, signer, currentSigners(tx.getWalletId()), now);
                quorum.appendSignature(tx, signer, sig);
                boolean claimed = quorum.claimExecution(tx, now, properties.getExecutionClaimTtl());
                return new Signed(pendingTransactionRepository.save(tx), signer, claimed);
            });
            PendingTransaction tx = signed.transaction();
            log.info("{} signed transaction {} ({}/{})", signed.signer(), transactionId, tx.getCurrentSignatures(), tx.getRequiredSignatures());
            audit(MultiSigAuditActions.TRANSACTION_SIGNED, signed.signer(), MultiSigAuditActions.RESOURCE_TRANSACTION, transactionId,
                    Map.of("currentSignatures", tx.getCurrentSignatures(), "requiredSignatures", tx.getRequiredSignatures()));
            if (!signed.claimed()) {
                return tx;
            }
            return executeClaimed(loadWallet(tx.getWalletId()), tx, signed.signer()).transaction();
        });
    }

    /**
     * Cancels a pending transaction. Any single current signer may cancel.
     *
     * @throws MultiSigException NOT_FOUND, NOT_PENDING, EXPIRED, UNAUTHORIZED, EXECUTION_IN_PROGRESS
     */
    public PendingTransaction cancel(String transactionId, String cancellerAddress) {
        return keyedLocks.withLock(transactionKey(transactionId), () -> {
            PendingTransaction cancelled = updateWithRetry(transactionId, tx -> {
                Instant now = Instant.now();
                String canceller = normalize(cancellerAddress, tx.getChain());
                expireIfOverdue(tx, now, canceller);
                quorum.checkCanCancel(tx, canceller, currentSigners(tx.getWalletId()), now, properties.getExecutionClaimTtl());
                quorum.markCancelled(tx, canceller, now);
                return pendingTransactionRepository.save(tx);
            });
            log.info("Transaction {} cancelled by {}", transactionId, cancelled.getCancelledBy());
            audit(MultiSigAuditActions.TRANSACTION_CANCELLED, cancelled.getCancelledBy(),
                    MultiSigAuditActions.RESOURCE_TRANSACTION, transactionId, Map.of("walletId", cancelled.getWalletId()));
            return cancelled;
        });
    }

    /**
     * Re-attempts execution of a pending transaction that already has enough signatures.
     *
     * @throws MultiSigException NOT_FOUND, NOT_PENDING, EXPIRED, UNAUTHORIZED, THRESHOLD_NOT_MET,
     *                           EXECUTION_IN_PROGRESS, EXECUTION_FAILED
     */
    public PendingTransaction retryExecution(String transactionId, String requesterAddress) {
        return keyedLocks.withLock(transactionKey(transactionId), () -> {
            Signed claimed = updateWithRetry(transactionId, tx -> {
                Instant now = Instant.now();
                String requester = normalize(requesterAddress, tx.getChain());
                expireIfOverdue(tx, now, requester);
                quorum.checkCanRetry(tx, requester, currentSigners(tx.getWalletId()), now, properties.getExecutionClaimTtl());
                quorum.claimExecution(tx, now, properties.getExecutionClaimTtl());
                return new Signed(pendingTransactionRepository.save(tx), requester, true);
            });
            log.info("{} retrying execution of transaction {} (attempt {})", claimed.signer(), transactionId,
                    claimed.transaction().getExecutionAttempts());
            ExecutionAttempt attempt = executeClaimed(loadWallet(claimed.transaction().getWalletId()), claimed.transaction(), claimed.signer());
            if (attempt.failure() != null) {
                throw new MultiSigException(MultiSigErrorCode.EXECUTION_FAILED, attempt.failure().getMessage(),
                        attempt.failure().getReason(), attempt.failure());
            }
            return attempt.transaction();
        });
    }

    /** Pending, unexpired transactions of the wallet, newest first. */
    public List<PendingTransaction> listPending(String walletId) {
        loadWallet(walletId);
        return pendingTransactionRepository.findByWalletIdAndStatusAndExpiresAtGreaterThanEqualOrderByCreatedAtDesc(
                walletId, PendingTransactionStatus.PENDING, Instant.now());
    }

    /** Reads a transaction; a pending one past its expiry is moved to EXPIRED first. */
    public PendingTransaction getTransaction(String transactionId) {
        PendingTransaction tx = loadTransaction(transactionId);
        Instant now = Instant.now();
        if (isOverdue(tx, now)) {
            return expire(tx.getId(), now, null).orElseGet(() -> loadTransaction(transactionId));
        }
        return tx;
    }

    /**
     * Typed transaction the owners must sign, against the Safe's current nonce.
     *
     * @throws MultiSigException NOT_FOUND, NOT_PENDING, ON_CHAIN_UNSUPPORTED_FOR_CHAIN, EXECUTION_FAILED
     */
    public TypedTransaction signingPayload(String transactionId) {
        PendingTransaction tx = getTransaction(transactionId);
        if (tx.getStatus() != PendingTransactionStatus.PENDING) {
            throw new MultiSigException(MultiSigErrorCode.NOT_PENDING, "Transaction " + transactionId + " is " + tx.getStatus());
        }
        MultiSigWallet wallet = loadWallet(tx.getWalletId());
        if (!executionAdapter.supports(wallet.getChain()) || !wallet.isDeployed()) {
            throw new MultiSigException(MultiSigErrorCode.ON_CHAIN_UNSUPPORTED_FOR_CHAIN,
                    "Wallet " + wallet.getId() + " has no deployed contract on " + wallet.getChain());
        }
        try {
            return executionAdapter.buildTransaction(wallet.getChain(), wallet.getAddress(), tx.getRecipient(),
                    toWei(tx.getAmount()), callData(tx.getMemo()));
        } catch (ChainExecutionException e) {
            throw new MultiSigException(MultiSigErrorCode.EXECUTION_FAILED, e.getMessage(), e.getReason(), e);
        }
    }

    /**
     * Moves every overdue pending transaction to EXPIRED. For an external scheduler; nothing here calls it periodically.
     *
     * @return number of transactions expired by this call
     */
    public int expireOverdue() {
        Instant now = Instant.now();
        int expired = 0;
        for (PendingTransaction tx : pendingTransactionRepository.findByStatusAndExpiresAtBefore(PendingTransactionStatus.PENDING, now)) {
            if (expire(tx.getId(), now, null).isPresent()) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue transaction(s)", expired);
        }
        return expired;
    }

    private ExecutionAttempt executeClaimed(MultiSigWallet wallet, PendingTransaction tx, String actor) {
        String executionHash;
        PendingTransaction.ExecutionMode mode;
        try {
            if (executionAdapter.supports(wallet.getChain()) && wallet.isDeployed()) {
                executionHash = executeOnChain(wallet, tx);
                mode = PendingTransaction.ExecutionMode.ON_CHAIN;
            } else {
                executionHash = addressFallback.offChainExecutionHash(tx.getId());
                mode = PendingTransaction.ExecutionMode.OFF_CHAIN;
            }
        } catch (ChainExecutionException e) {
            return new ExecutionAttempt(releaseAfterFailure(tx.getId(), actor, e), e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing transaction {}", tx.getId(), e);
            ChainExecutionException failure = unexpected("Execution of " + tx.getId(), e);
            return new ExecutionAttempt(releaseAfterFailure(tx.getId(), actor, failure), failure);
        }
        return completeExecution(wallet, tx.getId(), executionHash, mode, actor);
    }

    private ExecutionAttempt completeExecution(MultiSigWallet wallet, String transactionId, String executionHash,
                                               PendingTransaction.ExecutionMode mode, String actor) {
        PendingTransaction executed = updateWithRetry(transactionId, current -> {
            if (current.getStatus() != PendingTransactionStatus.PENDING) {
                return current;
            }
            quorum.markExecuted(current, executionHash, mode, Instant.now());
            return pendingTransactionRepository.save(current);
        });
        if (executed.getStatus() != PendingTransactionStatus.EXECUTED || !executionHash.equals(executed.getExecutionTxHash())) {
            log.error("Transaction {} became {} while executing; execution hash {} not recorded",
                    transactionId, executed.getStatus(), executionHash);
            return new ExecutionAttempt(executed, null);
        }
        log.info("Executed transaction {} on wallet {} ({}): {}", executed.getId(), wallet.getId(), mode, executionHash);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("walletId", wallet.getId());
        metadata.put("executionTxHash", executionHash);
        metadata.put("executionMode", mode.name());
        metadata.put("signers", executed.getSignedBy());
        audit(MultiSigAuditActions.TRANSACTION_EXECUTED, actor, MultiSigAuditActions.RESOURCE_TRANSACTION, executed.getId(), metadata);
        return new ExecutionAttempt(executed, null);
    }

    private String executeOnChain(MultiSigWallet wallet, PendingTransaction tx) {
        TypedTransaction typed = executionAdapter.buildTransaction(wallet.getChain(), wallet.getAddress(),
                tx.getRecipient(), toWei(tx.getAmount()), callData(tx.getMemo()));
        List<SignaturePacker.SignerSignature> signatures = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String signer : tx.getSignedBy()) {
            String signature = tx.getSignatures().get(signer);
            if (signature == null) {
                signature = externalSigner.requestSignature(wallet.getChain(), signer, typed).orElse(null);
            }
            if (signature == null || !SignaturePacker.isWellFormed(signature)) {
                missing.add(signer);
            } else {
                signatures.add(new SignaturePacker.SignerSignature(signer, signature));
            }
        }
        if (signatures.size() < tx.getRequiredSignatures()) {
            throw new ChainExecutionException(ExecutionFailureReason.MISSING_SIGNATURES,
                    signatures.size() + " of " + tx.getRequiredSignatures() + " signatures available; missing " + missing);
        }
        ExecutionResult result = executionAdapter.execute(wallet.getChain(), wallet.getAddress(), typed,
                signaturePacker.pack(signatures));
        chainTransactionRecorder.recordExecution(wallet, tx, result);
        return result.txHash();
    }

    private PendingTransaction releaseAfterFailure(String transactionId, String actor, ChainExecutionException failure) {
        String error = failure.getReason() + ": " + failure.getMessage();
        PendingTransaction released = updateWithRetry(transactionId, current -> {
            quorum.releaseClaim(current, error);
            return pendingTransactionRepository.save(current);
        });
        log.warn("Execution of transaction {} failed ({}), still pending: {}", transactionId, failure.getReason(), failure.getMessage());
        audit(MultiSigAuditActions.EXECUTION_FAILED, actor, MultiSigAuditActions.RESOURCE_TRANSACTION, transactionId,
                Map.of("reason", failure.getReason().name(), "attempt", released.getExecutionAttempts()));
        return released;
    }

    private void resolveAddress(MultiSigWallet wallet, List<String> owners) {
        if (executionAdapter.supports(wallet.getChain())) {
            try {
                DeploymentResult deployed = executionAdapter.deploy(
                        new DeploymentRequest(wallet.getId(), wallet.getChain(), owners, wallet.getThreshold()));
                wallet.setAddress(deployed.address());
                wallet.setAddressSource(MultiSigWallet.AddressSource.DEPLOYED);
                wallet.setDeploymentTxHash(deployed.txHash());
                chainTransactionRecorder.recordDeployment(wallet, deployed);
                return;
            } catch (ChainExecutionException e) {
                log.warn("Deployment of wallet {} on {} failed ({}), using placeholder address: {}",
                        wallet.getId(), wallet.getChain(), e.getReason(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure deploying wallet {} on {}, using placeholder address",
                        wallet.getId(), wallet.getChain(), e);
            }
        } else {
            log.info("On-chain execution not available for {}; wallet {} uses a placeholder address", wallet.getChain(), wallet.getId());
        }
        wallet.setAddress(addressFallback.placeholderAddress(wallet.getId()));
        wallet.setAddressSource(MultiSigWallet.AddressSource.PLACEHOLDER);
    }

    private static ChainExecutionException unexpected(String operation, RuntimeException e) {
        return new ChainExecutionException(ExecutionFailureReason.RPC_UNAVAILABLE, operation + " failed: " + e, e);
    }

    /** Loads, applies and saves; a lost optimistic race reloads and re-validates. */
    private <T> T updateWithRetry(String transactionId, Function<PendingTransaction, T> change) {
        int maxAttempts = Math.max(1, properties.getMaxUpdateAttempts());
        for (int attempt = 1; ; attempt++) {
            PendingTransaction tx = loadTransaction(transactionId);
            try {
                return change.apply(tx);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    throw new MultiSigException(MultiSigErrorCode.CONCURRENT_UPDATE,
                            "Transaction " + transactionId + " kept changing; gave up after " + attempt + " attempts");
                }
                log.warn("Concurrent update of transaction {}, retrying ({}/{})", transactionId, attempt, maxAttempts);
            }
        }
    }

    /** Lazy expiry: an overdue pending record is moved to EXPIRED and the calling operation fails with EXPIRED. */
    private void expireIfOverdue(PendingTransaction tx, Instant now, String actor) {
        if (isOverdue(tx, now)) {
            expire(tx.getId(), now, actor);
            throw new MultiSigException(MultiSigErrorCode.EXPIRED, "Transaction " + tx.getId() + " expired at " + tx.getExpiresAt());
        }
    }

    private boolean isOverdue(PendingTransaction tx, Instant now) {
        return tx.getStatus() == PendingTransactionStatus.PENDING && tx.isExpiredAt(now)
                && !quorum.hasLiveClaim(tx, now, properties.getExecutionClaimTtl());
    }

    private Optional<PendingTransaction> expire(String transactionId, Instant now, String actor) {
        Optional<PendingTransaction> expired = pendingTransactionRepository.markExpiredIfOverdue(
                transactionId, now, now.minus(properties.getExecutionClaimTtl()));
        expired.ifPresent(tx -> {
            log.info("Transaction {} expired ({}/{} signatures)", tx.getId(), tx.getCurrentSignatures(), tx.getRequiredSignatures());
            audit(MultiSigAuditActions.TRANSACTION_EXPIRED, actor, MultiSigAuditActions.RESOURCE_TRANSACTION, tx.getId(),
                    Map.of("walletId", tx.getWalletId(), "expiresAt", tx.getExpiresAt().toString()));
        });
        return expired;
    }

    private MultiSigWallet refreshSignerCount(MultiSigWallet wallet) {
        wallet.setTotalSigners((int) signerRepository.countByWalletId(wallet.getId()));
        wallet.setUpdatedAt(Instant.now());
        return walletRepository.save(wallet);
    }

    private List<SignerSpec> normalizeSigners(ChainId chain, List<SignerSpec> signers) {
        if (signers == null || signers.isEmpty()) {
            throw new MultiSigException(MultiSigErrorCode.THRESHOLD_INVARIANT_VIOLATED, "At least one signer required");
        }
        Set<String> seen = new LinkedHashSet<>();
        List<SignerSpec> normalized = new ArrayList<>(signers.size());
        for (SignerSpec spec : signers) {
            String address = normalize(spec.address(), chain);
            if (!seen.add(address)) {
                throw new MultiSigException(MultiSigErrorCode.DUPLICATE_SIGNER, "Duplicate signer " + address);
            }
            normalized.add(new SignerSpec(address, spec.name(), spec.email()));
        }
        return normalized;
    }

    private static MultiSigSigner newSigner(String walletId, SignerSpec spec, Instant now) {
        MultiSigSigner signer = new MultiSigSigner();
        signer.setWalletId(walletId);
        signer.setAddress(spec.address());
        signer.setName(spec.name());
        signer.setEmail(spec.email());
        signer.setAddedAt(now);
        return signer;
    }

    private Set<String> currentSigners(String walletId) {
        Set<String> addresses = new LinkedHashSet<>();
        signerRepository.findByWalletIdOrderByAddedAtAsc(walletId).forEach(s -> addresses.add(s.getAddress()));
        return addresses;
    }

    private MultiSigWallet loadWallet(String walletId) {
        return walletRepository.findById(walletId).orElseThrow(() -> MultiSigException.notFound("Wallet", walletId));
    }

    private PendingTransaction loadTransaction(String transactionId) {
        return pendingTransactionRepository.findById(transactionId)
                .orElseThrow(() -> MultiSigException.notFound("Transaction", transactionId));
    }

    private static void requireOwner(MultiSigWallet wallet, String userId) {
        if (wallet.getUserId() != null && !wallet.getUserId().equals(userId)) {
            throw new MultiSigException(MultiSigErrorCode.UNAUTHORIZED, "Wallet " + wallet.getId() + " belongs to another user");
        }
    }

    private static String normalize(String address, ChainId chain) {
        try {
            return AddressNormalizer.normalize(address, chain.getAddressFormat());
        } catch (InvalidAddressException e) {
            throw new MultiSigException(MultiSigErrorCode.INVALID_ADDRESS, e.getMessage());
        }
    }

    private static String validateAmount(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new MultiSigException(MultiSigErrorCode.INVALID_AMOUNT, "Amount is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new MultiSigException(MultiSigErrorCode.INVALID_AMOUNT, "Not a decimal amount: " + amount);
        }
        if (value.signum() < 0) {
            throw new MultiSigException(MultiSigErrorCode.INVALID_AMOUNT, "Amount must not be negative: " + amount);
        }
        if (value.stripTrailingZeros().scale() > WEI_DECIMALS) {
            throw new MultiSigException(MultiSigErrorCode.INVALID_AMOUNT, "More than " + WEI_DECIMALS + " decimals: " + amount);
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private static String validateSignature(String signature) {
        if (signature == null || signature.isBlank()) {
            return null;
        }
        if (!SignaturePacker.isWellFormed(signature)) {
            throw new MultiSigException(MultiSigErrorCode.INVALID_SIGNATURE,
                    "Signature must be " + SignaturePacker.SIGNATURE_LENGTH + " bytes of hex");
        }
        String trimmed = signature.trim();
        return trimmed.startsWith("0x") ? trimmed : "0x" + trimmed;
    }

    static BigInteger toWei(String amount) {
        return new BigDecimal(amount).movePointRight(WEI_DECIMALS).toBigIntegerExact();
    }

    /** Memo is forwarded as call data only when it is 0x-prefixed hex. */
    static String callData(String memo) {
        if (memo != null && memo.startsWith("0x") && memo.length() % 2 == 0 && memo.substring(2).matches("[0-9a-fA-F]*")) {
            return memo;
        }
        return "0x";
    }

    private void audit(String action, String actor, String resource, String resourceId, Map<String, Object> metadata) {
        try {
            applicationEventPublisher.publishEvent(new MultiSigAuditEvent(action, actor, resource, resourceId, metadata, Instant.now()));
        } catch (RuntimeException e) {
            log.warn("Could not publish audit event {} for {}: {}", action, resourceId, e.getMessage());
        }
    }

    private static String transactionKey(String transactionId) {
        return "tx:" + transactionId;
    }

    private static String walletKey(String walletId) {
        return "wallet:" + walletId;
    }

    private record Signed(PendingTransaction transaction, String signer, boolean claimed) {
    }

    private record ExecutionAttempt(PendingTransaction transaction, ChainExecutionException failure) {
    }
}
