package com.openfashion.crowdfundingservice.core.config;

import com.openfashion.crowdfundingservice.core.exceptions.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthorizedCallerException.class)
    public ResponseEntity<Object> handleUnauthorized(UnauthorizedCallerException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "UNAUTHORIZED_CALLER", ex.getMessage());
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Object> handleInvalidInput(InvalidInputException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", message);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Object> handleMissingHeader(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Missing header " + ex.getHeaderName());
    }

    @ExceptionHandler(CampaignNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(CampaignNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "CAMPAIGN_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidCampaignStateException.class)
    public ResponseEntity<Object> handleInvalidState(InvalidCampaignStateException ex) {
        return buildResponse(HttpStatus.CONFLICT, "INVALID_STATE", ex.getMessage());
    }

    @ExceptionHandler(TemporalViolationException.class)
    public ResponseEntity<Object> handleTemporal(TemporalViolationException ex) {
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, "TEMPORAL_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(ConservationViolationException.class)
    public ResponseEntity<Object> handleConservation(ConservationViolationException ex) {
        log.error("Ledger conservation check failed: {}", ex.getMessage());
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "CONSERVATION_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(SystemPausedException.class)
    public ResponseEntity<Object> handlePaused(SystemPausedException ex) {
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "SYSTEM_PAUSED", ex.getMessage());
    }

    @ExceptionHandler(SystemNotPausedException.class)
    public ResponseEntity<Object> handleNotPaused(SystemNotPausedException ex) {
        return buildResponse(HttpStatus.CONFLICT, "SYSTEM_NOT_PAUSED", ex.getMessage());
    }

    @ExceptionHandler(CampaignBusyException.class)
    public ResponseEntity<Object> handleBusy(CampaignBusyException ex) {
        return buildResponse(HttpStatus.CONFLICT, "CAMPAIGN_BUSY", ex.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Object> handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        log.warn("Concurrent update survived retries: {}", ex.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "Concurrent update, please retry");
    }

    @ExceptionHandler(TokenTransferException.class)
    public ResponseEntity<Object> handleTransfer(TokenTransferException ex) {
        return buildResponse(HttpStatus.CONFLICT, "TOKEN_TRANSFER_FAILED", ex.getMessage());
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
