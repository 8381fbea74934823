package com.fintech.idempotency.domain.exception;

import java.util.List;

/**
 * Request body that cannot be read as a transaction or fails validation.
 */
public class InvalidTransactionRequestException extends RuntimeException {

    private final List<String> errors;

    public InvalidTransactionRequestException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public InvalidTransactionRequestException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}
