package com.payment.gateway.api;

import com.payment.gateway.core.AuxiliaryValidationException;
import com.payment.gateway.core.GatewayException;
import com.payment.gateway.core.GatewayOperationException;
import com.payment.gateway.core.MalformedResponseException;
import com.payment.gateway.core.SignatureMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the gateway API. Returns consistent JSON
 * and a status code per failure kind.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(AuxiliaryValidationException.class)
    public ResponseEntity<Map<String, Object>> handleAuxiliaryValidation(AuxiliaryValidationException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "message", ex.getMessage(), "violations", ex.getViolations()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(SignatureMismatchException.class)
    public ResponseEntity<Map<String, String>> handleSignatureMismatch(SignatureMismatchException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "SIGNATURE_MISMATCH", "message", ex.getMessage()));
    }

    @ExceptionHandler(GatewayOperationException.class)
    public ResponseEntity<Map<String, String>> handleOperationFailed(GatewayOperationException ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "GATEWAY_OPERATION_FAILED");
        body.put("code", ex.getCode());
        if (ex.getSubCode() != null) {
            body.put("subCode", ex.getSubCode());
        }
        body.put("message", getMessageOrCause(ex));
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(MalformedResponseException.class)
    public ResponseEntity<Map<String, String>> handleMalformed(MalformedResponseException ex) {
        log.warn("Malformed gateway payload: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "MALFORMED_RESPONSE", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(RestClientException.class)
    public ResponseEntity<Map<String, String>> handleTransport(RestClientException ex) {
        log.error("Gateway transport failure", ex);
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "TRANSPORT_ERROR", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, String>> handleGateway(GatewayException ex) {
        log.error("Gateway error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "GATEWAY_ERROR", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
