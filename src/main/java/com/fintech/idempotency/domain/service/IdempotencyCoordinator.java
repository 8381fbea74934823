package com.fintech.idempotency.domain.service;

import com.fintech.idempotency.config.IdempotencyProperties;
import com.fintech.idempotency.domain.exception.IdempotencyException;
import com.fintech.idempotency.domain.exception.IdempotencyKeyConflictException;
import com.fintech.idempotency.domain.exception.IdempotencyKeyExpiredException;
import com.fintech.idempotency.domain.exception.IdempotencyStorageException;
import com.fintech.idempotency.domain.exception.InvalidIdempotencyKeyException;
import com.fintech.idempotency.domain.exception.MethodNotAllowedException;
import com.fintech.idempotency.domain.model.IdempotencyDecision;
import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.domain.model.LookupTier;
import com.fintech.idempotency.infrastructure.persistence.IdempotencyRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Admission decision for idempotent requests.
 *
 * Decision Flow:
 * 1. Reject methods that are not protected (405) and missing keys (400),
 *    before touching any store
 * 2. Fingerprint the request body (SHA-256)
 * 3. Look the key up in the cache, then in the database
 * 4. On a hit: different fingerprint -> conflict (409),
 *    past expiresAt -> expired (419), otherwise replay
 * 5. On a total miss: admit
 *
 * The database is queried by key alone, so a reused key with a different body
 * is detected even when the cache has lost the entry.
 *
 * Stateless and read-only: the only writes happen in {@link IdempotencyService}
 * after an ADMIT decision.
 */
@Slf4j
@Service
public class IdempotencyCoordinator {

    static final int MAX_KEY_LENGTH = 255;

    private final List<IdempotencyRecordLookup> lookups;
    private final RequestFingerprint fingerprint;
    private final IdempotencyProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public IdempotencyCoordinator(IdempotencyCache cache,
                                  IdempotencyRecordStore recordStore,
                                  RequestFingerprint fingerprint,
                                  IdempotencyProperties properties,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.lookups = List.of(cache, recordStore);
        this.fingerprint = fingerprint;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Decide what to do with an incoming request.
     *
     * @param method HTTP method of the request
     * @param idempotencyKey client-supplied key, may be null
     * @param rawBody serialized request body the fingerprint is computed over
     * @return REPLAY with the recorded response, or ADMIT for first-time processing
     */
    public IdempotencyDecision admit(String method, String idempotencyKey, byte[] rawBody) {
        if (!properties.isProtectedMethod(method)) {
            throw new MethodNotAllowedException(method);
        }
        if (idempotencyKey == null || idempotencyKey.isBlank() || idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new InvalidIdempotencyKeyException();
        }

        String bodyHash = fingerprint.of(rawBody);
        return decide(idempotencyKey, bodyHash);
    }

    /**
     * Run the two-tier lookup for an already fingerprinted request.
     * Also used to re-check a key after losing an admission race.
     */
    public IdempotencyDecision decide(String idempotencyKey, String bodyHash) {
        for (IdempotencyRecordLookup lookup : lookups) {
            Optional<IdempotencyRecord> found = find(lookup, idempotencyKey);
            if (found.isPresent()) {
                return evaluate(found.get(), bodyHash, lookup.tier());
            }
        }

        record("admit", LookupTier.NONE);
        log.debug("Idempotency key admitted for first-time processing: {}", idempotencyKey);
        return IdempotencyDecision.admit(idempotencyKey, bodyHash);
    }

    private IdempotencyDecision evaluate(IdempotencyRecord stored, String bodyHash, LookupTier tier) {
        if (!stored.matches(bodyHash)) {
            record("conflict", tier);
            log.warn("Idempotency key reused with a different body: key={}, tier={}", stored.getKey(), tier.tag());
            throw new IdempotencyKeyConflictException();
        }

        if (stored.isExpiredAt(clock.instant())) {
            record("expired", tier);
            log.warn("Idempotency key expired: key={}, expiresAt={}", stored.getKey(), stored.getExpiresAt());
            throw new IdempotencyKeyExpiredException();
        }

        record("replay", tier);
        log.info("Duplicate request detected for key: {} (tier: {})", stored.getKey(), tier.tag());
        return IdempotencyDecision.replay(stored, tier);
    }

    private Optional<IdempotencyRecord> find(IdempotencyRecordLookup lookup, String idempotencyKey) {
        try {
            return lookup.find(idempotencyKey);
        } catch (IdempotencyException e) {
            throw e;
        } catch (RuntimeException e) {
            if (lookup.tier() == LookupTier.CACHE) {
                // cache is optional, the database tier is still consulted
                Counter.builder("idempotency.cache.errors")
                        .tag("operation", "get")
                        .register(meterRegistry)
                        .increment();
                log.warn("Idempotency cache lookup failed for key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
                return Optional.empty();
            }
            log.error("Idempotency lookup failed: key={}, tier={}: {}",
                    idempotencyKey, lookup.tier().tag(), e.getMessage(), e);
            throw new IdempotencyStorageException("Unable to verify the idempotency key at this time.", e);
        }
    }

    private void record(String result, LookupTier tier) {
        Counter.builder("idempotency.decisions")
                .tag("result", result)
                .tag("tier", tier.tag())
                .register(meterRegistry)
                .increment();
    }
}
