package com.fintech.idempotency.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model of a recorded idempotent operation.
 *
 * Both lookup tiers (cache and database) return this exact shape, so the
 * conflict / expiry / replay decision does not depend on where the record came from.
 * This is also the JSON value stored in the cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {

    private String key;
    private String bodyHash;
    private String responsePayload;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    @JsonIgnore
    public boolean matches(String otherBodyHash) {
        return bodyHash != null && bodyHash.equals(otherBodyHash);
    }
}
