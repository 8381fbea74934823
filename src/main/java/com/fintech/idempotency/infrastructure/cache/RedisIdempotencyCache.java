package com.fintech.idempotency.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.idempotency.config.IdempotencyProperties;
import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.domain.model.LookupTier;
import com.fintech.idempotency.domain.service.IdempotencyCache;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Redis tier of the idempotency lookup.
 *
 * Entries live under {@code <prefix>:<idempotency-key>} as JSON
 * {@link IdempotencyRecord}s. The Redis TTL never outlives the record's
 * expiresAt; expiry is still re-checked on read by the coordinator.
 *
 * Failure Handling:
 * - Redis unavailable: circuit breaker opens, reads degrade to a miss, writes are skipped
 * - Unreadable entry: treated as a miss and removed
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisIdempotencyCache implements IdempotencyCache {

    static final String CIRCUIT_BREAKER = "idempotencyCache";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final IdempotencyProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Override
    public LookupTier tier() {
        return LookupTier.CACHE;
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "findFallback")
    public Optional<IdempotencyRecord> find(String idempotencyKey) {
        String cacheKey = properties.cacheKey(idempotencyKey);
        String json = redisTemplate.opsForValue().get(cacheKey);
        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, IdempotencyRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable idempotency cache entry {}: {}", cacheKey, e.getMessage());
            redisTemplate.delete(cacheKey);
            return Optional.empty();
        }
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "putFallback")
    public void put(IdempotencyRecord record) {
        Duration ttl = cacheTtl(record);
        if (ttl.isZero() || ttl.isNegative()) {
            log.debug("Not caching idempotency record {}: already past its validity window", record.getKey());
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize idempotency record {} for caching: {}", record.getKey(), e.getMessage());
            return;
        }

        redisTemplate.opsForValue().set(properties.cacheKey(record.getKey()), json, ttl);
        log.debug("Cached idempotency record {} (ttl: {}s)", record.getKey(), ttl.toSeconds());
    }

    Duration cacheTtl(IdempotencyRecord record) {
        Duration configured = properties.ttl();
        if (record.getExpiresAt() == null) {
            return configured;
        }
        Duration remaining = Duration.between(clock.instant(), record.getExpiresAt());
        return remaining.compareTo(configured) < 0 ? remaining : configured;
    }

    Optional<IdempotencyRecord> findFallback(String idempotencyKey, Throwable t) {
        cacheError("get");
        log.warn("Idempotency cache unavailable for key {}, using database: {}", idempotencyKey, t.getMessage());
        return Optional.empty();
    }

    void putFallback(IdempotencyRecord record, Throwable t) {
        cacheError("put");
        log.warn("Skipping idempotency cache write for key {}: {}", record.getKey(), t.getMessage());
    }

    private void cacheError(String operation) {
        Counter.builder("idempotency.cache.errors")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
