package com.fintech.idempotency.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Outcome of an admission check.
 *
 * REPLAY carries the recorded response; ADMIT authorizes exactly one execution
 * of the protected operation for (key, bodyHash). Rejections are exceptions,
 * not decisions.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class IdempotencyDecision {

    private final Type type;
    private final String key;
    private final String bodyHash;
    private final IdempotencyRecord record;
    private final LookupTier tier;

    public enum Type {
        ADMIT,
        REPLAY
    }

    public static IdempotencyDecision admit(String key, String bodyHash) {
        return new IdempotencyDecision(Type.ADMIT, key, bodyHash, null, LookupTier.NONE);
    }

    public static IdempotencyDecision replay(IdempotencyRecord record, LookupTier tier) {
        Objects.requireNonNull(record, "record");
        return new IdempotencyDecision(Type.REPLAY, record.getKey(), record.getBodyHash(), record, tier);
    }

    public boolean isReplay() {
        return type == Type.REPLAY;
    }

    public String getResponsePayload() {
        return record == null ? null : record.getResponsePayload();
    }
}
