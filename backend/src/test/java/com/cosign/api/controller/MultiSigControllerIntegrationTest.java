package com.cosign.api.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.Map;

/**
 * Wallet → proposal → signature over HTTP, with every chain left off-chain.
 */
@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class MultiSigControllerIntegrationTest {

    private static final String A = "0x1000000000000000000000000000000000000001";
    private static final String B = "0x2000000000000000000000000000000000000002";
    private static final String C = "0x3000000000000000000000000000000000000003";
    private static final String RECIPIENT = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;

    @Test
    @DisplayName("2-of-3 wallet: propose returns 201 pending, second signature executes off-chain")
    void proposeAndSign_executes() {
        String walletId = createWallet("user-1");

        Map<?, ?> proposed = webTestClient.post().uri("/api/v1/multisig/wallets/{id}/transactions", walletId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("proposer", A, "recipient", RECIPIENT, "amount", "0.5", "memo", "payroll"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult().getResponseBody();
        String txId = (String) proposed.get("id");

        webTestClient.get().uri("/api/v1/multisig/wallets/{id}/pending", walletId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].currentSignatures").isEqualTo(1);

        webTestClient.post().uri("/api/v1/multisig/transactions/{id}/signatures", txId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("signer", B))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("EXECUTED")
                .jsonPath("$.executionMode").isEqualTo("OFF_CHAIN")
                .jsonPath("$.executionTxHash").exists();

        webTestClient.post().uri("/api/v1/multisig/transactions/{id}/signatures", txId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("signer", C))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_PENDING");

        webTestClient.get().uri("/api/v1/multisig/transactions/{id}/signing-payload", txId)
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    @DisplayName("created wallet gets a placeholder address and is listed for its owner")
    void createWallet_placeholderAndListing() {
        String walletId = createWallet("user-2");

        webTestClient.get().uri("/api/v1/multisig/wallets/{id}", walletId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.addressSource").isEqualTo("PLACEHOLDER")
                .jsonPath("$.threshold").isEqualTo(2)
                .jsonPath("$.signers.length()").isEqualTo(3);

        webTestClient.get().uri("/api/v1/multisig/wallets")
                .header(MultiSigController.USER_HEADER, "user-2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(walletId);
    }

    @Test
    void cancel_thenSignConflicts() {
        String walletId = createWallet("user-3");
        Map<?, ?> proposed = webTestClient.post().uri("/api/v1/multisig/wallets/{id}/transactions", walletId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("proposer", A, "recipient", RECIPIENT, "amount", "1"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult().getResponseBody();

        webTestClient.post().uri("/api/v1/multisig/transactions/{id}/cancel", proposed.get("id"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("signer", C))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("CANCELLED")
                .jsonPath("$.cancelledBy").isEqualTo(C);
    }

    @Test
    void removeSigner_belowThreshold_returns400() {
        String walletId = webTestClient.post().uri("/api/v1/multisig/wallets")
                .header(MultiSigController.USER_HEADER, "user-4")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"chain":"POLYGON","signers":[{"address":"%s"},{"address":"%s"}],"threshold":2}
                        """.formatted(A, B))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult().getResponseBody().get("id").toString();

        webTestClient.delete().uri("/api/v1/multisig/wallets/{id}/signers/{address}", walletId, B)
                .header(MultiSigController.USER_HEADER, "user-4")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("THRESHOLD_INVARIANT_VIOLATED");
    }

    @Test
    void createWallet_invalidSignerAddress_returns400() {
        webTestClient.post().uri("/api/v1/multisig/wallets")
                .header(MultiSigController.USER_HEADER, "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"chain":"ETHEREUM","signers":[{"address":"invalid"}],"threshold":1}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }

    @Test
    void createWallet_thresholdAboveSigners_returns400() {
        webTestClient.post().uri("/api/v1/multisig/wallets")
                .header(MultiSigController.USER_HEADER, "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"chain":"ETHEREUM","signers":[{"address":"%s"}],"threshold":2}
                        """.formatted(A))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("THRESHOLD_INVARIANT_VIOLATED");
    }

    @Test
    void unknownTransaction_returns404() {
        webTestClient.get().uri("/api/v1/multisig/transactions/{id}", "000000000000000000000000")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    private String createWallet(String userId) {
        Map<?, ?> created = webTestClient.post().uri("/api/v1/multisig/wallets")
                .header(MultiSigController.USER_HEADER, userId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"chain":"POLYGON","signers":[{"address":"%s","name":"alice"},{"address":"%s"},{"address":"%s"}],
                         "threshold":2,"label":"treasury"}
                        """.formatted(A, B, C))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult().getResponseBody();
        return (String) created.get("id");
    }
}
