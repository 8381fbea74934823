package com.fintech.idempotency.domain.exception;

/**
 * Same request body, but the recorded response is past its validity window.
 */
public class IdempotencyKeyExpiredException extends IdempotencyException {

    public static final int STATUS = 419;

    public IdempotencyKeyExpiredException() {
        super(STATUS, "Idempotency key expired",
                "The idempotency key has expired and cannot be used for this transaction.");
    }
}
