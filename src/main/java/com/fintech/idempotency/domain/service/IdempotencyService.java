package com.fintech.idempotency.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.idempotency.config.IdempotencyProperties;
import com.fintech.idempotency.domain.exception.IdempotencyStorageException;
import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.infrastructure.persistence.IdempotencyRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Write-through execution of an admitted request.
 *
 * Processing Flow:
 * 1. Open a database transaction
 * 2. Run the protected operation
 * 3. Serialize its result (the response replayed on retries)
 * 4. Insert the idempotency record in the same transaction
 * 5. Commit (all or nothing)
 * 6. Copy the committed record into the cache, best-effort
 *
 * Failure Handling:
 * - Operation throws: rollback, exception passes through unchanged
 * - Key already recorded by a concurrent request: rollback,
 *   {@link com.fintech.idempotency.domain.exception.IdempotencyKeyTakenException}
 * - Thread interrupted or transaction timeout: rollback, no cache write
 * - Cache write fails: logged, the commit stands
 */
@Slf4j
@Service
public class IdempotencyService {

    private final IdempotencyRecordStore recordStore;
    private final IdempotencyCache cache;
    private final ObjectMapper objectMapper;
    private final IdempotencyProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate transactionTemplate;

    public IdempotencyService(IdempotencyRecordStore recordStore,
                              IdempotencyCache cache,
                              ObjectMapper objectMapper,
                              IdempotencyProperties properties,
                              Clock clock,
                              MeterRegistry meterRegistry,
                              PlatformTransactionManager transactionManager) {
        this.recordStore = recordStore;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(properties.transactionTimeoutSeconds());
    }

    /**
     * Execute the protected operation and record its response atomically.
     *
     * @param idempotencyKey admitted key
     * @param bodyHash fingerprint of the admitted request body
     * @param operation business effect; must run in the caller's transaction
     * @return the committed idempotency record, holding the serialized response
     */
    public IdempotencyRecord execute(String idempotencyKey, String bodyHash, Supplier<?> operation) {
        IdempotencyRecord committed = transactionTemplate.execute(status -> {
            Object result = operation.get();
            String responsePayload = serialize(idempotencyKey, result);

            abortIfCancelled(idempotencyKey);

            Instant now = clock.instant();
            IdempotencyRecord record = IdempotencyRecord.builder()
                    .key(idempotencyKey)
                    .bodyHash(bodyHash)
                    .responsePayload(responsePayload)
                    .createdAt(now)
                    .updatedAt(now)
                    .expiresAt(now.plus(properties.ttl()))
                    .build();

            recordStore.insert(record);

            abortIfCancelled(idempotencyKey);
            return record;
        });

        log.debug("Stored idempotency record for key: {}", idempotencyKey);

        writeThrough(committed);
        return committed;
    }

    private String serialize(String idempotencyKey, Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Error serializing response for idempotency key {}: {}", idempotencyKey, e.getMessage(), e);
            throw new IdempotencyStorageException("Unable to record the response for this request.", e);
        }
    }

    private void abortIfCancelled(String idempotencyKey) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Request cancelled before commit, rolling back: key={}", idempotencyKey);
            throw new IdempotencyStorageException("The request was cancelled before it completed.");
        }
    }

    private void writeThrough(IdempotencyRecord record) {
        try {
            cache.put(record);
        } catch (RuntimeException e) {
            Counter.builder("idempotency.cache.errors")
                    .tag("operation", "put")
                    .register(meterRegistry)
                    .increment();
            log.warn("Failed to cache idempotency record for key {}: {}", record.getKey(), e.getMessage());
        }
    }
}
