package com.fintech.idempotency.domain.exception;

import lombok.Getter;

/**
 * Base type for idempotency rejections and failures.
 *
 * Carries the HTTP status the web layer responds with, a stable short message
 * and a human-readable detail. Status 419 has no {@code HttpStatus} constant,
 * so the raw code is kept.
 */
@Getter
public abstract class IdempotencyException extends RuntimeException {

    private final int status;
    private final String detail;

    protected IdempotencyException(int status, String message, String detail) {
        super(message);
        this.status = status;
        this.detail = detail;
    }

    protected IdempotencyException(int status, String message, String detail, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.detail = detail;
    }
}
