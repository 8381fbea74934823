package com.fintech.idempotency.domain.model;

import lombok.Value;

/**
 * Serialized response of an idempotent request and whether it was replayed.
 *
 * First executions and replays expose the same payload string, so a retry
 * returns exactly what the first call returned.
 */
@Value
public class IdempotentOutcome {

    String responsePayload;
    boolean replayed;

    public static IdempotentOutcome created(String responsePayload) {
        return new IdempotentOutcome(responsePayload, false);
    }

    public static IdempotentOutcome replayed(String responsePayload) {
        return new IdempotentOutcome(responsePayload, true);
    }
}
