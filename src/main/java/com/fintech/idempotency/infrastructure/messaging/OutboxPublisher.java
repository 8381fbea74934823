package com.fintech.idempotency.infrastructure.messaging;

import com.fintech.idempotency.infrastructure.persistence.entity.OutboxEventEntity;
import com.fintech.idempotency.infrastructure.persistence.repository.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes committed TRANSACTION_CREATED outbox rows to Kafka.
 *
 * Only rows of admissions that committed exist, so a request rolled back by the
 * idempotency layer (duplicate key, failed insert, cancellation) never produces
 * an event. Delivery is at-least-once; consumers dedupe on the transaction id.
 *
 * Failure Handling:
 * - Send fails or times out: attempt recorded, row stays PENDING and is retried
 *   on the next poll; after {@code app.outbox.max-attempts} it is parked as FAILED
 * - Interrupted (shutdown): batch stops, the current and remaining rows stay PENDING
 * - Service crashes mid-batch: unsent rows stay PENDING and are picked up after restart
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.transaction-events}")
    private String transactionEventsTopic;

    @Value("${app.outbox.batch-size:50}")
    private int batchSize;

    @Value("${app.outbox.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Value("${app.outbox.max-attempts:5}")
    private int maxAttempts;

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:500}")
    @Transactional
    public void publishPendingEvents() {
        List<OutboxEventEntity> pending = outboxEventRepository.findByStatusOrderByCreatedAtAsc(
                OutboxEventEntity.EventStatus.PENDING, PageRequest.of(0, batchSize));

        if (pending.isEmpty()) {
            return;
        }

        log.debug("Publishing {} pending outbox events", pending.size());

        for (OutboxEventEntity event : pending) {
            if (!publish(event)) {
                break;
            }
            outboxEventRepository.save(event);
        }
    }

    /**
     * @return false if interrupted; the event is left untouched
     */
    boolean publish(OutboxEventEntity event) {
        try {
            kafkaTemplate.send(transactionEventsTopic, event.getAggregateId(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            event.markPublished(clock.instant());
            count("published");
            log.debug("Published outbox event {} to {}", event.getEventId(), transactionEventsTopic);
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing outbox event {}, leaving it pending", event.getEventId());
            return false;

        } catch (ExecutionException | TimeoutException e) {
            event.recordFailure(e.getMessage(), maxAttempts);
            if (event.getStatus() == OutboxEventEntity.EventStatus.FAILED) {
                count("failed");
                log.error("Giving up on outbox event {} after {} attempts: {}",
                        event.getEventId(), event.getAttempts(), e.getMessage(), e);
            } else {
                count("retry");
                log.warn("Failed to publish outbox event {} (attempt {}/{}), will retry: {}",
                        event.getEventId(), event.getAttempts(), maxAttempts, e.getMessage());
            }
            return true;
        }
    }

    private void count(String result) {
        Counter.builder("outbox.events")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
