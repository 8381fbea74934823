package com.fintech.idempotency.domain.exception;

public class InvalidTransactionQueryException extends RuntimeException {

    public InvalidTransactionQueryException(String message) {
        super(message);
    }
}
