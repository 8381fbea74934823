package com.fintech.idempotency.infrastructure.persistence;

import com.fintech.idempotency.domain.exception.IdempotencyKeyTakenException;
import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.domain.model.LookupTier;
import com.fintech.idempotency.domain.service.IdempotencyRecordLookup;
import com.fintech.idempotency.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.fintech.idempotency.infrastructure.persistence.repository.IdempotencyRecordRepository;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Database tier of the idempotency lookup and the durable half of write-through.
 *
 * Authoritative: consulted on every cache miss.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyRecordStore implements IdempotencyRecordLookup {

    private final IdempotencyRecordRepository repository;

    @Override
    public LookupTier tier() {
        return LookupTier.DATABASE;
    }

    /**
     * Retry handles transient failures (connection resets, lock timeouts);
     * anything else surfaces as a storage error in the coordinator.
     */
    @Override
    @Retry(name = "idempotencyStore")
    @Transactional(readOnly = true)
    public Optional<IdempotencyRecord> find(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(IdempotencyRecordStore::toRecord);
    }

    /**
     * Insert inside the caller's transaction and flush immediately, so a
     * duplicate key fails here rather than at commit time.
     *
     * @throws IdempotencyKeyTakenException if another request already recorded this key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void insert(IdempotencyRecord record) {
        try {
            repository.saveAndFlush(toEntity(record));
        } catch (DataIntegrityViolationException e) {
            log.info("Idempotency key already recorded by a concurrent request: {}", record.getKey());
            throw new IdempotencyKeyTakenException(record.getKey(), e);
        }
    }

    static IdempotencyRecord toRecord(IdempotencyRecordEntity entity) {
        return IdempotencyRecord.builder()
                .key(entity.getIdempotencyKey())
                .bodyHash(entity.getBodyHash())
                .responsePayload(entity.getResponsePayload())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .expiresAt(entity.getExpiresAt())
                .build();
    }

    static IdempotencyRecordEntity toEntity(IdempotencyRecord record) {
        return IdempotencyRecordEntity.builder()
                .idempotencyKey(record.getKey())
                .bodyHash(record.getBodyHash())
                .responsePayload(record.getResponsePayload())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .expiresAt(record.getExpiresAt())
                .build();
    }
}
