package com.fintech.idempotency.domain.exception;

public class MethodNotAllowedException extends IdempotencyException {

    public MethodNotAllowedException(String method) {
        super(405, "Method not allowed",
                "The " + method + " method is not allowed for idempotent operations.");
    }
}
