package com.corebank.ledger.exception;

import com.corebank.ledger.dto.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * ERROR KIND → HTTP STATUS MAPPING:
 *
 * Exception / kind                  | HTTP Status | When
 * ----------------------------------|-------------|------------------------------------------
 * NOT_FOUND                         | 404         | Account, holding, product or price missing
 * VALIDATION_ERROR                  | 400         | Bad amount, shares above holding, limits
 * MethodArgumentNotValidException   | 400         | Bean Validation failure on DTO fields
 * INSUFFICIENT_FUNDS                | 409         | Debit would drive a balance negative
 * BUSINESS_RULE_VIOLATION           | 422         | Self transfer, inactive holding, opening rules
 * IMBALANCED_ENTRIES                | 500         | Internal double-entry violation
 * STORE_FAILURE                     | 503         | Persistence unavailable; safe to retry
 * Exception (fallback)              | 500         | Unexpected system errors
 *
 * RULES:
 * - No stack traces in responses
 * - All responses use the ErrorResponse shape except the validation field map
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CoreBankException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleCoreBank(CoreBankException ex) {
        HttpStatus status = statusOf(ex.getKind());
        String message = ex.getMessage();
        if (ex.getKind() == ErrorKind.STORE_FAILURE) {
            // do not leak driver messages
            message = "The ledger store is temporarily unavailable. Please retry.";
        }
        return ResponseEntity
                .status(status)
                .body(new ApiResponses.ErrorResponse(ex.getKind().name(), message, ex.getKind().isRetryable()));
    }

    /**
     * Handles @Valid/@NotNull/@DecimalMin annotation failures on request DTOs.
     * Returns a field → message map instead of generic error for clearer API feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    /**
     * Unreadable JSON, a malformed UUID in the path or a missing X-User-Id header.
     */
    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingRequestHeaderException.class
    })
    public ResponseEntity<ApiResponses.ErrorResponse> handleBadRequest(Exception ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse(ErrorKind.VALIDATION_ERROR.name(), "Malformed request"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse(ErrorKind.VALIDATION_ERROR.name(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", ex.getMessage()));
    }

    /**
     * Safety net for any unhandled exception.
     * Message is deliberately generic; internal detail must not leak to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse(
                        "INTERNAL_SERVER_ERROR",
                        "An unexpected error occurred. Please contact support."
                ));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS:
                return HttpStatus.CONFLICT;
            case BUSINESS_RULE_VIOLATION:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STORE_FAILURE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case IMBALANCED_ENTRIES:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
