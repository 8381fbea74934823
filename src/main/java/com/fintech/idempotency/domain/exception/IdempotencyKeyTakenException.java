package com.fintech.idempotency.domain.exception;

/**
 * Raised when the idempotency record insert hits the unique key constraint,
 * i.e. a concurrent request admitted the same key first. The surrounding
 * transaction is rolled back and the lookup path is re-run.
 */
public class IdempotencyKeyTakenException extends RuntimeException {

    private final String idempotencyKey;

    public IdempotencyKeyTakenException(String idempotencyKey, Throwable cause) {
        super("Idempotency key already recorded: " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
