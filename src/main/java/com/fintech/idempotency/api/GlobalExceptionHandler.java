package com.fintech.idempotency.api;

import com.fintech.idempotency.domain.exception.IdempotencyException;
import com.fintech.idempotency.domain.exception.InvalidTransactionQueryException;
import com.fintech.idempotency.domain.exception.InvalidTransactionRequestException;
import com.fintech.idempotency.domain.exception.TransactionsNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to the {@link ApiResponse} envelope.
 *
 * Server-side failures are logged with their cause but answered with a generic
 * detail; no exception messages or stack traces reach the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IdempotencyException.class)
    public ResponseEntity<ApiResponse<Void>> handleIdempotency(IdempotencyException ex, HttpServletRequest request) {
        if (ex.getStatus() >= 500) {
            log.error("Idempotency failure on {}: {}", request.getRequestURI(), ex.getDetail(), ex.getCause());
        } else {
            log.warn("Idempotency rejection on {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus())
                .body(ApiResponse.failure(ex.getMessage(), ex.getDetail(), request.getRequestURI()));
    }

    @ExceptionHandler(InvalidTransactionRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(InvalidTransactionRequestException ex,
                                                                  HttpServletRequest request) {
        log.warn("Transaction request rejected: {}", ex.getErrors());
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure("Invalid transaction request", ex.getErrors(), request.getRequestURI()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure("Invalid transaction request",
                        "Request body is missing or malformed", request.getRequestURI()));
    }

    @ExceptionHandler(InvalidTransactionQueryException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadQuery(InvalidTransactionQueryException ex,
                                                            HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure("Invalid query parameters", ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                HttpServletRequest request) {
        log.warn("Invalid value for query parameter {} on {}", ex.getName(), request.getRequestURI());
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure("Invalid query parameters",
                        "page and limit must be integers", request.getRequestURI()));
    }

    @ExceptionHandler(TransactionsNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(TransactionsNotFoundException ex,
                                                            HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.failure("No transactions found", ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex,
                                                                      HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ApiResponse.failure("Method not allowed",
                        "The " + ex.getMethod() + " method is not supported for this resource.",
                        request.getRequestURI()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Database error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("Database error",
                        "An error occurred while interacting with the database", request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("Internal server error",
                        "An unexpected error occurred", request.getRequestURI()));
    }
}
