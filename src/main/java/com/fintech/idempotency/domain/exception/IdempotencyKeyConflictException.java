package com.fintech.idempotency.domain.exception;

/**
 * Key already owned by a different request body.
 */
public class IdempotencyKeyConflictException extends IdempotencyException {

    public IdempotencyKeyConflictException() {
        super(409, "Idempotency key conflict",
                "A transaction with this idempotency key already exists with a different request body.");
    }
}
