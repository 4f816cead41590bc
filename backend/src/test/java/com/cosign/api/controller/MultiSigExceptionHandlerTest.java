package com.cosign.api.controller;

import com.cosign.api.dto.ErrorBody;
import com.cosign.chain.ExecutionFailureReason;
import com.cosign.multisig.MultiSigErrorCode;
import com.cosign.multisig.MultiSigException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class MultiSigExceptionHandlerTest {

    private final MultiSigExceptionHandler handler = new MultiSigExceptionHandler();

    @Test
    void statusOf_coversEveryCode() {
        for (MultiSigErrorCode code : MultiSigErrorCode.values()) {
            assertThat(MultiSigExceptionHandler.statusOf(code)).isNotNull();
        }
        assertThat(MultiSigExceptionHandler.statusOf(MultiSigErrorCode.NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(MultiSigExceptionHandler.statusOf(MultiSigErrorCode.UNAUTHORIZED)).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(MultiSigExceptionHandler.statusOf(MultiSigErrorCode.ON_CHAIN_UNSUPPORTED_FOR_CHAIN)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        for (MultiSigErrorCode code : EnumSet.of(MultiSigErrorCode.NOT_PENDING, MultiSigErrorCode.EXPIRED, MultiSigErrorCode.ALREADY_SIGNED)) {
            assertThat(MultiSigExceptionHandler.statusOf(code)).isEqualTo(HttpStatus.CONFLICT);
        }
    }

    @Test
    void handleMultiSig_withFailureReason_appendsReason() {
        ResponseEntity<ErrorBody> response = handler.handleMultiSig(new MultiSigException(
                MultiSigErrorCode.EXECUTION_FAILED, "reverted", ExecutionFailureReason.REVERTED, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().error()).isEqualTo("EXECUTION_FAILED:REVERTED");
        assertThat(response.getBody().message()).isEqualTo("reverted");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void handleMultiSig_plainCode() {
        ResponseEntity<ErrorBody> response = handler.handleMultiSig(new MultiSigException(MultiSigErrorCode.INVALID_AMOUNT, "bad"));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().error()).isEqualTo("INVALID_AMOUNT");
    }

    @Test
    void handleConcurrentUpdate_conflict() {
        ResponseEntity<ErrorBody> response = handler.handleConcurrentUpdate(new OptimisticLockingFailureException("stale"));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().error()).isEqualTo("CONCURRENT_UPDATE");
    }
}
