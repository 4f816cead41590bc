package com.cosign.api.controller;

import com.cosign.api.dto.ErrorBody;
import com.cosign.multisig.MultiSigErrorCode;
import com.cosign.multisig.MultiSigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link MultiSigException} codes to HTTP status with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class MultiSigExceptionHandler {

    @ExceptionHandler(MultiSigException.class)
    public ResponseEntity<ErrorBody> handleMultiSig(MultiSigException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("{}: {}", ex.getErrorCode(), ex.getMessage());
        }
        String error = ex.getFailureReason() != null
                ? ex.getErrorCode().name() + ":" + ex.getFailureReason().name()
                : ex.getErrorCode().name();
        return ResponseEntity.status(status).body(ErrorBody.of(error, ex.getMessage()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorBody> handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorBody.of(MultiSigErrorCode.CONCURRENT_UPDATE.name(), "Concurrent update, retry the request"));
    }

    static HttpStatus statusOf(MultiSigErrorCode code) {
        return switch (code) {
            case INVALID_ADDRESS, INVALID_AMOUNT, INVALID_SIGNATURE, THRESHOLD_INVARIANT_VIOLATED -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_PENDING, EXPIRED, ALREADY_SIGNED, DUPLICATE_SIGNER, THRESHOLD_NOT_MET, EXECUTION_IN_PROGRESS,
                    CONCURRENT_UPDATE -> HttpStatus.CONFLICT;
            case ON_CHAIN_UNSUPPORTED_FOR_CHAIN -> HttpStatus.UNPROCESSABLE_ENTITY;
            case DEPLOYMENT_FAILED, EXECUTION_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }
}
