package com.fintech.idempotency.domain.exception;

/**
 * Cache or database failure while coordinating an idempotent request.
 *
 * The detail is safe to return to clients; the cause is only logged.
 */
public class IdempotencyStorageException extends IdempotencyException {

    public IdempotencyStorageException(String detail, Throwable cause) {
        super(500, "Error checking idempotency key", detail, cause);
    }

    public IdempotencyStorageException(String detail) {
        super(500, "Error checking idempotency key", detail);
    }
}
