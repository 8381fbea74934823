package com.fintech.idempotency.domain.service;

import com.fintech.idempotency.config.IdempotencyProperties;
import com.fintech.idempotency.domain.exception.IdempotencyKeyTakenException;
import com.fintech.idempotency.domain.exception.IdempotencyStorageException;
import com.fintech.idempotency.domain.model.IdempotencyDecision;
import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.domain.model.IdempotentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Entry point for idempotent request processing: admission, execution and
 * reconciliation of admission races.
 *
 * Two requests for the same new key can both be admitted. Only one of them can
 * insert the idempotency record; the other rolls back (business effect included)
 * and re-runs the lookup, which now finds the winner's record and yields a replay,
 * a conflict or an expiry like any later retry would.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotentRequestHandler {

    private final IdempotencyCoordinator coordinator;
    private final IdempotencyService idempotencyService;
    private final IdempotencyProperties properties;
    private final MeterRegistry meterRegistry;

    public IdempotentOutcome handle(String method, String idempotencyKey, byte[] rawBody, Supplier<?> operation) {
        IdempotencyDecision decision = coordinator.admit(method, idempotencyKey, rawBody);

        int attempts = 0;
        while (!decision.isReplay()) {
            try {
                IdempotencyRecord record = idempotencyService.execute(
                        decision.getKey(), decision.getBodyHash(), operation);
                return IdempotentOutcome.created(record.getResponsePayload());

            } catch (IdempotencyKeyTakenException e) {
                attempts++;
                Counter.builder("idempotency.reconciliations")
                        .register(meterRegistry)
                        .increment();

                if (attempts >= properties.maxReconcileAttempts()) {
                    log.error("Giving up on idempotency key {} after {} concurrent admissions",
                            decision.getKey(), attempts, e);
                    throw new IdempotencyStorageException(
                            "Unable to resolve concurrent requests for this idempotency key.", e);
                }

                log.warn("Concurrent admission for key {}, re-running lookup (attempt {}/{})",
                        decision.getKey(), attempts, properties.maxReconcileAttempts());
                decision = coordinator.decide(decision.getKey(), decision.getBodyHash());
            }
        }

        return IdempotentOutcome.replayed(decision.getResponsePayload());
    }
}
