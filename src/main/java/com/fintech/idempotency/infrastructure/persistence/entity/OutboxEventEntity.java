package com.fintech.idempotency.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Pending domain event, written in the same transaction as the transaction row
 * and its idempotency record. A rolled-back admission therefore never emits an
 * event; {@code OutboxPublisher} ships committed rows to Kafka.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status_created", columnList = "status,created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    public static final String TRANSACTION_CREATED = "TRANSACTION_CREATED";

    @Id
    @Column(name = "event_id", columnDefinition = "UUID")
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_error", length = 500)
    private String lastError;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markPublished(Instant at) {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = at;
        this.attempts++;
        this.lastError = null;
    }

    /**
     * Record a failed send. The row stays PENDING for the next poll until
     * {@code maxAttempts} sends have failed, then it is parked as FAILED.
     */
    public void recordFailure(String error, int maxAttempts) {
        this.attempts++;
        this.lastError = error != null && error.length() > 500 ? error.substring(0, 500) : error;
        if (attempts >= maxAttempts) {
            this.status = EventStatus.FAILED;
        }
    }
}
