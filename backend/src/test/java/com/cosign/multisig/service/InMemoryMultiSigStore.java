package com.cosign.multisig.service;

import com.cosign.domain.MultiSigSigner;
import com.cosign.domain.MultiSigSignerRepository;
import com.cosign.domain.MultiSigWallet;
import com.cosign.domain.MultiSigWalletRepository;
import com.cosign.domain.PendingTransaction;
import com.cosign.domain.PendingTransactionRepository;
import com.cosign.domain.PendingTransactionStatus;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mongo stand-in for service tests: pending transactions are stored as copies and saved with the same
 * version check Spring Data applies to {@code @Version} fields.
 */
class InMemoryMultiSigStore {

    private final AtomicLong ids = new AtomicLong();
    private final Map<String, MultiSigWallet> wallets = new ConcurrentHashMap<>();
    private final List<MultiSigSigner> signers = new CopyOnWriteArrayList<>();
    private final Map<String, PendingTransaction> transactions = new ConcurrentHashMap<>();

    final MultiSigWalletRepository walletRepository = mock(MultiSigWalletRepository.class);
    final MultiSigSignerRepository signerRepository = mock(MultiSigSignerRepository.class);
    final PendingTransactionRepository pendingTransactionRepository = mock(PendingTransactionRepository.class);

    InMemoryMultiSigStore() {
        when(walletRepository.save(any(MultiSigWallet.class))).thenAnswer(inv -> {
            MultiSigWallet wallet = inv.getArgument(0);
            if (wallet.getId() == null) {
                wallet.setId("wallet-" + ids.incrementAndGet());
            }
            wallets.put(wallet.getId(), wallet);
            return wallet;
        });
        when(walletRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(wallets.get(inv.<String>getArgument(0))));
        when(walletRepository.findByUserIdOrderByCreatedAtDesc(anyString())).thenAnswer(inv -> wallets.values().stream()
                .filter(w -> inv.getArgument(0).equals(w.getUserId()))
                .sorted(Comparator.comparing(MultiSigWallet::getCreatedAt).reversed())
                .toList());

        when(signerRepository.save(any(MultiSigSigner.class))).thenAnswer(inv -> {
            MultiSigSigner signer = inv.getArgument(0);
            signer.setId("signer-" + ids.incrementAndGet());
            signers.add(signer);
            return signer;
        });
        when(signerRepository.findByWalletIdOrderByAddedAtAsc(anyString())).thenAnswer(inv -> signersOf(inv.getArgument(0)));
        when(signerRepository.countByWalletId(anyString())).thenAnswer(inv -> (long) signersOf(inv.getArgument(0)).size());
        when(signerRepository.existsByWalletIdAndAddress(anyString(), anyString())).thenAnswer(inv ->
                signersOf(inv.getArgument(0)).stream().anyMatch(s -> s.getAddress().equals(inv.getArgument(1))));
        when(signerRepository.deleteByWalletIdAndAddress(anyString(), anyString())).thenAnswer(inv -> {
            List<MultiSigSigner> matching = signersOf(inv.getArgument(0)).stream()
                    .filter(s -> s.getAddress().equals(inv.getArgument(1)))
                    .toList();
            signers.removeAll(matching);
            return (long) matching.size();
        });

        when(pendingTransactionRepository.save(any(PendingTransaction.class))).thenAnswer(inv -> save(inv.getArgument(0)));
        when(pendingTransactionRepository.findById(anyString())).thenAnswer(inv ->
                Optional.ofNullable(transactions.get(inv.<String>getArgument(0))).map(InMemoryMultiSigStore::copy));
        when(pendingTransactionRepository.findByWalletIdAndStatusAndExpiresAtGreaterThanEqualOrderByCreatedAtDesc(anyString(), any(), any()))
                .thenAnswer(inv -> transactions.values().stream()
                        .filter(tx -> tx.getWalletId().equals(inv.getArgument(0)))
                        .filter(tx -> tx.getStatus() == inv.getArgument(1))
                        .filter(tx -> !tx.getExpiresAt().isBefore(inv.getArgument(2)))
                        .sorted(Comparator.comparing(PendingTransaction::getCreatedAt).reversed())
                        .map(InMemoryMultiSigStore::copy)
                        .toList());
        when(pendingTransactionRepository.findByStatusAndExpiresAtBefore(any(), any())).thenAnswer(inv -> transactions.values().stream()
                .filter(tx -> tx.getStatus() == inv.getArgument(0))
                .filter(tx -> tx.getExpiresAt().isBefore(inv.getArgument(1)))
                .map(InMemoryMultiSigStore::copy)
                .toList());
        when(pendingTransactionRepository.markExpiredIfOverdue(anyString(), any(), any())).thenAnswer(inv ->
                markExpired(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
    }

    PendingTransaction stored(String id) {
        return copy(transactions.get(id));
    }

    /** Rewrites the stored record bypassing the version check. */
    synchronized void overwrite(String id, Consumer<PendingTransaction> change) {
        PendingTransaction tx = transactions.get(id);
        change.accept(tx);
    }

    private List<MultiSigSigner> signersOf(String walletId) {
        return signers.stream()
                .filter(s -> s.getWalletId().equals(walletId))
                .sorted(Comparator.comparing(MultiSigSigner::getAddedAt))
                .toList();
    }

    private synchronized PendingTransaction save(PendingTransaction incoming) {
        PendingTransaction current = incoming.getId() != null ? transactions.get(incoming.getId()) : null;
        if (current != null && !Objects.equals(current.getVersion(), incoming.getVersion())) {
            throw new OptimisticLockingFailureException("Stale version " + incoming.getVersion() + " of " + incoming.getId());
        }
        PendingTransaction stored = copy(incoming);
        if (stored.getId() == null) {
            stored.setId("tx-" + ids.incrementAndGet());
        }
        stored.setVersion(current == null ? 0L : current.getVersion() + 1);
        transactions.put(stored.getId(), stored);
        incoming.setId(stored.getId());
        incoming.setVersion(stored.getVersion());
        return copy(stored);
    }

    private synchronized Optional<PendingTransaction> markExpired(String id, Instant now, Instant claimStaleBefore) {
        PendingTransaction tx = transactions.get(id);
        if (tx == null || tx.getStatus() != PendingTransactionStatus.PENDING || !tx.getExpiresAt().isBefore(now)) {
            return Optional.empty();
        }
        if (tx.getExecutionClaimedAt() != null && !tx.getExecutionClaimedAt().isBefore(claimStaleBefore)) {
            return Optional.empty();
        }
        tx.setStatus(PendingTransactionStatus.EXPIRED);
        tx.setCompletedAt(now);
        tx.setExecutionClaimedAt(null);
        tx.setVersion(tx.getVersion() + 1);
        return Optional.of(copy(tx));
    }

    static PendingTransaction copy(PendingTransaction source) {
        if (source == null) {
            return null;
        }
        PendingTransaction copy = new PendingTransaction();
        copy.setId(source.getId());
        copy.setWalletId(source.getWalletId());
        copy.setChain(source.getChain());
        copy.setRecipient(source.getRecipient());
        copy.setAmount(source.getAmount());
        copy.setMemo(source.getMemo());
        copy.setRequiredSignatures(source.getRequiredSignatures());
        copy.setCurrentSignatures(source.getCurrentSignatures());
        copy.setSignedBy(new ArrayList<>(source.getSignedBy()));
        copy.setSignatures(new LinkedHashMap<>(source.getSignatures()));
        copy.setProposer(source.getProposer());
        copy.setStatus(source.getStatus());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setExpiresAt(source.getExpiresAt());
        copy.setCompletedAt(source.getCompletedAt());
        copy.setExecutionTxHash(source.getExecutionTxHash());
        copy.setExecutionMode(source.getExecutionMode());
        copy.setExecutionClaimedAt(source.getExecutionClaimedAt());
        copy.setExecutionAttempts(source.getExecutionAttempts());
        copy.setLastExecutionError(source.getLastExecutionError());
        copy.setCancelledBy(source.getCancelledBy());
        copy.setVersion(source.getVersion());
        return copy;
    }
}
