package com.fintech.idempotency.domain.exception;

public class InvalidIdempotencyKeyException extends IdempotencyException {

    public InvalidIdempotencyKeyException() {
        super(400, "Invalid idempotency key",
                "Idempotency key is required and must be a non-empty string");
    }
}
