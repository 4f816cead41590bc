package com.cosign.api.controller;

import com.cosign.api.dto.CreateWalletRequest;
import com.cosign.api.dto.ExpireOverdueResponse;
import com.cosign.api.dto.PendingTransactionResponse;
import com.cosign.api.dto.ProposeTransactionRequest;
import com.cosign.api.dto.SignTransactionRequest;
import com.cosign.api.dto.SignerActionRequest;
import com.cosign.api.dto.SignerRequest;
import com.cosign.api.dto.SigningPayloadResponse;
import com.cosign.api.dto.WalletResponse;
import com.cosign.multisig.service.MultiSigService;
import com.cosign.multisig.service.SignerSpec;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Multi-sig wallets and their pending transactions. The acting user arrives in X-User-Id; the acting signer
 * in the request body. Service calls block (Mongo, chain RPC) and run on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/multisig")
@RequiredArgsConstructor
public class MultiSigController {

    static final String USER_HEADER = "X-User-Id";

    private final MultiSigService multiSigService;

    @PostMapping("/wallets")
    public Mono<ResponseEntity<WalletResponse>> createWallet(@RequestHeader(USER_HEADER) String userId,
                                                             @Valid @RequestBody CreateWalletRequest request) {
        List<SignerSpec> signers = request.signers().stream().map(MultiSigController::toSpec).toList();
        return blocking(() -> ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(
                multiSigService.createWallet(userId, request.chain(), signers, request.threshold(), request.label()))));
    }

    @GetMapping("/wallets")
    public Mono<ResponseEntity<List<WalletResponse>>> listWallets(@RequestHeader(USER_HEADER) String userId) {
        return blocking(() -> ResponseEntity.ok(multiSigService.listWallets(userId).stream().map(WalletResponse::from).toList()));
    }

    @GetMapping("/wallets/{walletId}")
    public Mono<ResponseEntity<WalletResponse>> getWallet(@PathVariable String walletId) {
        return blocking(() -> ResponseEntity.ok(WalletResponse.from(multiSigService.getWallet(walletId))));
    }

    @PostMapping("/wallets/{walletId}/signers")
    public Mono<ResponseEntity<WalletResponse>> addSigner(@PathVariable String walletId,
                                                          @RequestHeader(USER_HEADER) String userId,
                                                          @Valid @RequestBody SignerRequest request) {
        return blocking(() -> ResponseEntity.ok(WalletResponse.from(multiSigService.addSigner(walletId, userId, toSpec(request)))));
    }

    @DeleteMapping("/wallets/{walletId}/signers/{address}")
    public Mono<ResponseEntity<WalletResponse>> removeSigner(@PathVariable String walletId,
                                                             @PathVariable String address,
                                                             @RequestHeader(USER_HEADER) String userId) {
        return blocking(() -> ResponseEntity.ok(WalletResponse.from(multiSigService.removeSigner(walletId, userId, address))));
    }

    @GetMapping("/wallets/{walletId}/pending")
    public Mono<ResponseEntity<List<PendingTransactionResponse>>> listPending(@PathVariable String walletId) {
        return blocking(() -> ResponseEntity.ok(multiSigService.listPending(walletId).stream()
                .map(PendingTransactionResponse::from)
                .toList()));
    }

    @PostMapping("/wallets/{walletId}/transactions")
    public Mono<ResponseEntity<PendingTransactionResponse>> propose(@PathVariable String walletId,
                                                                    @Valid @RequestBody ProposeTransactionRequest request) {
        return blocking(() -> ResponseEntity.status(HttpStatus.CREATED).body(PendingTransactionResponse.from(
                multiSigService.propose(walletId, request.proposer(), request.recipient(), request.amount(),
                        request.memo(), request.signature()))));
    }

    @GetMapping("/transactions/{transactionId}")
    public Mono<ResponseEntity<PendingTransactionResponse>> getTransaction(@PathVariable String transactionId) {
        return blocking(() -> ResponseEntity.ok(PendingTransactionResponse.from(multiSigService.getTransaction(transactionId))));
    }

    @GetMapping("/transactions/{transactionId}/signing-payload")
    public Mono<ResponseEntity<SigningPayloadResponse>> signingPayload(@PathVariable String transactionId) {
        return blocking(() -> ResponseEntity.ok(SigningPayloadResponse.from(transactionId,
                multiSigService.signingPayload(transactionId))));
    }

    @PostMapping("/transactions/{transactionId}/signatures")
    public Mono<ResponseEntity<PendingTransactionResponse>> sign(@PathVariable String transactionId,
                                                                 @Valid @RequestBody SignTransactionRequest request) {
        return blocking(() -> ResponseEntity.ok(PendingTransactionResponse.from(
                multiSigService.sign(transactionId, request.signer(), request.signature()))));
    }

    @PostMapping("/transactions/{transactionId}/cancel")
    public Mono<ResponseEntity<PendingTransactionResponse>> cancel(@PathVariable String transactionId,
                                                                   @Valid @RequestBody SignerActionRequest request) {
        return blocking(() -> ResponseEntity.ok(PendingTransactionResponse.from(
                multiSigService.cancel(transactionId, request.signer()))));
    }

    @PostMapping("/transactions/{transactionId}/retry")
    public Mono<ResponseEntity<PendingTransactionResponse>> retry(@PathVariable String transactionId,
                                                                  @Valid @RequestBody SignerActionRequest request) {
        return blocking(() -> ResponseEntity.ok(PendingTransactionResponse.from(
                multiSigService.retryExecution(transactionId, request.signer()))));
    }

    /** Bulk expiry for an external scheduler. */
    @PostMapping("/transactions/expire-overdue")
    public Mono<ResponseEntity<ExpireOverdueResponse>> expireOverdue() {
        return blocking(() -> ResponseEntity.ok(new ExpireOverdueResponse(multiSigService.expireOverdue())));
    }

    private static SignerSpec toSpec(SignerRequest request) {
        return new SignerSpec(request.address(), request.name(), request.email());
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
