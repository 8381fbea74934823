package com.fintech.idempotency.domain.exception;

public class TransactionsNotFoundException extends RuntimeException {

    public TransactionsNotFoundException() {
        super("There are no transactions available at the moment.");
    }
}
