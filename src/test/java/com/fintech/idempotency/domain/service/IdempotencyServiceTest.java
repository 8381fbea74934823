package com.fintech.idempotency.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.idempotency.config.IdempotencyProperties;
import com.fintech.idempotency.domain.exception.IdempotencyKeyTakenException;
import com.fintech.idempotency.domain.exception.IdempotencyStorageException;
import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.domain.model.TransactionResponse;
import com.fintech.idempotency.domain.model.TransactionType;
import com.fintech.idempotency.infrastructure.persistence.IdempotencyRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-17T10:00:00Z");
    private static final String KEY = "unique-key-123";
    private static final String HASH = "5e2bf57d3f40c4b6df69daf1936cb766f832374b4fc0259a7cbff06e2f70f269";

    @Mock private IdempotencyRecordStore recordStore;
    @Mock private IdempotencyCache cache;
    @Mock private PlatformTransactionManager transactionManager;

    private final TransactionStatus txStatus = new SimpleTransactionStatus();
    private ObjectMapper objectMapper;
    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        lenient().when(transactionManager.getTransaction(any(TransactionDefinition.class))).thenReturn(txStatus);

        idempotencyService = new IdempotencyService(
                recordStore,
                cache,
                objectMapper,
                IdempotencyProperties.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                new SimpleMeterRegistry(),
                transactionManager
        );
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void execute_success_insertsRecordCommitsThenCaches() throws Exception {
        TransactionResponse response = transaction();

        IdempotencyRecord record = idempotencyService.execute(KEY, HASH, () -> response);

        assertEquals(KEY, record.getKey());
        assertEquals(HASH, record.getBodyHash());
        assertEquals(objectMapper.writeValueAsString(response), record.getResponsePayload());
        assertEquals(NOW, record.getCreatedAt());
        assertEquals(NOW.plus(Duration.ofHours(1)), record.getExpiresAt());

        var order = inOrder(recordStore, transactionManager, cache);
        order.verify(recordStore).insert(record);
        order.verify(transactionManager).commit(txStatus);
        order.verify(cache).put(record);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void execute_appliesConfiguredTimeout() {
        idempotencyService.execute(KEY, HASH, this::transaction);

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertEquals(10, definition.getValue().getTimeout());
    }

    @Test
    void execute_operationFails_rollsBackAndPassesErrorThrough() {
        IllegalStateException failure = new IllegalStateException("consumer is blocked");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> idempotencyService.execute(KEY, HASH, () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        verify(transactionManager).rollback(txStatus);
        verify(transactionManager, never()).commit(any());
        verify(recordStore, never()).insert(any());
        verifyNoInteractions(cache);
    }

    @Test
    void execute_recordInsertFails_rollsBackBusinessEffect() {
        doThrow(new IdempotencyKeyTakenException(KEY, new DataIntegrityViolationException("duplicate key")))
                .when(recordStore).insert(any());

        assertThrows(IdempotencyKeyTakenException.class,
                () -> idempotencyService.execute(KEY, HASH, this::transaction));

        verify(transactionManager).rollback(txStatus);
        verify(transactionManager, never()).commit(any());
        verifyNoInteractions(cache);
    }

    @Test
    void execute_cancelledBeforeCommit_rollsBackWithoutCaching() {
        IdempotencyStorageException ex = assertThrows(IdempotencyStorageException.class,
                () -> idempotencyService.execute(KEY, HASH, () -> {
                    Thread.currentThread().interrupt();
                    return transaction();
                }));

        assertEquals(500, ex.getStatus());
        assertTrue(Thread.currentThread().isInterrupted());
        verify(recordStore, never()).insert(any());
        verify(transactionManager).rollback(txStatus);
        verifyNoInteractions(cache);
    }

    @Test
    void execute_cacheWriteFails_commitStands() {
        doThrow(new RedisConnectionFailureException("redis down")).when(cache).put(any());

        IdempotencyRecord record = assertDoesNotThrow(
                () -> idempotencyService.execute(KEY, HASH, this::transaction));

        assertNotNull(record.getResponsePayload());
        verify(transactionManager).commit(txStatus);
        verify(transactionManager, never()).rollback(any());
    }

    private TransactionResponse transaction() {
        return TransactionResponse.builder()
                .id(UUID.fromString("9b2f6a2e-4c1d-4e7a-a5a4-0f7c3b8f2d11"))
                .type(TransactionType.PAYMENT)
                .amount(new BigDecimal("12000"))
                .status("pending")
                .consumerId(UUID.fromString("2e37c8a4-9b2f-4d7e-8c1a-3f5b6d7e8f60"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
