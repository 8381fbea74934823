package com.fintech.idempotency.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable idempotency record.
 *
 * Written once, in the same transaction as the business effect it protects.
 * The unique constraint on idempotency_key decides which of two concurrent
 * admissions for the same key wins.
 */
@Entity
@Table(name = "idempotency_records", indexes = {
    @Index(name = "uk_idempotency_records_key", columnList = "idempotency_key", unique = true),
    @Index(name = "idx_idempotency_records_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecordEntity {

    @Id
    @Column(name = "record_id", columnDefinition = "UUID")
    private UUID recordId;

    @Column(name = "idempotency_key", nullable = false, unique = true, length = 255, updatable = false)
    private String idempotencyKey;

    @Column(name = "body_hash", nullable = false, length = 64, updatable = false)
    private String bodyHash;

    @Column(name = "response_payload", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String responsePayload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @PrePersist
    protected void onCreate() {
        if (recordId == null) {
            recordId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
