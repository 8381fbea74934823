package com.fintech.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.idempotency.domain.exception.IdempotencyKeyTakenException;
import com.fintech.idempotency.domain.model.TransactionRequest;
import com.fintech.idempotency.domain.model.TransactionType;
import com.fintech.idempotency.domain.service.IdempotencyService;
import com.fintech.idempotency.domain.service.RequestFingerprint;
import com.fintech.idempotency.domain.service.TransactionService;
import com.fintech.idempotency.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.fintech.idempotency.infrastructure.persistence.repository.IdempotencyRecordRepository;
import com.fintech.idempotency.infrastructure.persistence.repository.OutboxEventRepository;
import com.fintech.idempotency.infrastructure.persistence.repository.TransactionRepository;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full request path against H2, with Redis replaced by an in-memory map and a
 * controllable clock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class IdempotencyFlowIntegrationTest {

    private static final Instant START = Instant.parse("2026-10-17T10:00:00Z");
    private static final String CONSUMER = "2e37c8a4-9b2f-4d7e-8c1a-3f5b6d7e8f60";

    @Autowired
    MockMvc mvc;

    @Autowired
    TransactionRepository transactionRepository;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    @Autowired
    IdempotencyRecordRepository idempotencyRecordRepository;

    @Autowired
    IdempotencyService idempotencyService;

    @Autowired
    TransactionService transactionService;

    @Autowired
    RequestFingerprint requestFingerprint;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    StringRedisTemplate redisTemplate;

    @MockBean
    Clock clock;

    private final Map<String, String> redis = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> now = new AtomicReference<>(START);

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxEventRepository.deleteAll();
        transactionRepository.deleteAll();
        idempotencyRecordRepository.deleteAll();
        redis.clear();
        now.set(START);

        given(clock.instant()).willAnswer(invocation -> now.get());

        ValueOperations<String, String> ops = mock(ValueOperations.class);
        given(redisTemplate.opsForValue()).willReturn(ops);
        given(ops.get(anyString())).willAnswer(invocation -> redis.get(invocation.<String>getArgument(0)));
        doAnswer(invocation -> {
            redis.put(invocation.getArgument(0), invocation.getArgument(1));
            return null;
        }).when(ops).set(anyString(), anyString(), any(Duration.class));
        given(redisTemplate.delete(anyString()))
                .willAnswer(invocation -> redis.remove(invocation.<String>getArgument(0)) != null);
    }

    @Test
    void createOnceReplayConflictAndExpiry() throws Exception {
        String firstId = idOf(create("unique-key-123", body("payment", "12000"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Transaction created successfully"))
                .andExpect(jsonPath("$.data.status").value("pending")));

        assertTrue(redis.containsKey("idempotency:unique-key-123"));

        String replayedId = idOf(create("unique-key-123", body("payment", "12000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Transaction already processed")));
        assertEquals(firstId, replayedId);

        create("unique-key-123", body("payment", "15000"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Idempotency key conflict"));

        String otherId = idOf(create("unique-key-456", body("payment", "12000"))
                .andExpect(status().isCreated()));
        assertNotEquals(firstId, otherId);

        mvc.perform(post("/api/v1/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("payment", "12000")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid idempotency key"));

        now.set(START.plus(Duration.ofHours(2)));

        create("unique-key-123", body("payment", "12000"))
                .andExpect(status().is(419))
                .andExpect(jsonPath("$.message").value("Idempotency key expired"));

        assertEquals(2, transactionRepository.count());
        assertEquals(2, idempotencyRecordRepository.count());
        assertEquals(1, outboxEventRepository.countByIdempotencyKey("unique-key-123"));
    }

    @Test
    void sameKeyWithExtraOrReorderedFieldsIsAConflict() throws Exception {
        String body = body("payment", "12000");
        String firstId = idOf(create("fingerprint-key", body).andExpect(status().isCreated()));

        create("fingerprint-key", body.substring(0, body.length() - 1) + ",\"note\":\"refund me\"}")
                .andExpect(status().isConflict());

        create("fingerprint-key", "{\"consumerId\":\"" + CONSUMER + "\",\"amount\":12000,\"type\":\"payment\"}")
                .andExpect(status().isConflict());

        String replayedId = idOf(create("fingerprint-key",
                "{ \"type\" : \"payment\",\n  \"amount\" : 12000,\n  \"consumerId\" : \"" + CONSUMER + "\" }")
                .andExpect(status().isOk()));
        assertEquals(firstId, replayedId);

        assertEquals(1, transactionRepository.count());
    }

    @Test
    void concurrentFirstSubmissionsCreateOneTransaction() throws Exception {
        int clients = 8;
        ExecutorService executor = Executors.newFixedThreadPool(clients);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String[]>> results = new ArrayList<>();
            for (int i = 0; i < clients; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    MockHttpServletResponse response = create("race-key", body("payment", "12000")).andReturn().getResponse();
                    return new String[] {String.valueOf(response.getStatus()), response.getContentAsString()};
                }));
            }
            start.countDown();

            List<String[]> responses = new ArrayList<>();
            for (Future<String[]> result : results) {
                responses.add(result.get(30, TimeUnit.SECONDS));
            }

            assertEquals(1, responses.stream().filter(r -> r[0].equals("201")).count());
            assertEquals(clients - 1, responses.stream().filter(r -> r[0].equals("200")).count());
            Set<String> ids = responses.stream()
                    .map(r -> JsonPath.<String>read(r[1], "$.data.id"))
                    .collect(Collectors.toSet());
            assertEquals(1, ids.size());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, transactionRepository.count());
        assertEquals(1, idempotencyRecordRepository.count());
        assertEquals(1, outboxEventRepository.countByIdempotencyKey("race-key"));
    }

    @Test
    void unsupportedMethodIsRejectedWithoutSideEffects() throws Exception {
        mvc.perform(put("/api/v1/transactions")
                        .header("Idempotency-Key", "put-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("payment", "12000")))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.message").value("Method not allowed"));

        assertEquals(0, transactionRepository.count());
        assertEquals(0, idempotencyRecordRepository.count());
    }

    @Test
    void replayServedFromDatabaseWhenCacheLosesEntry() throws Exception {
        String firstId = idOf(create("cache-miss-key", body("withdrawal", "250.50"))
                .andExpect(status().isCreated()));

        redis.clear();

        String replayedId = idOf(create("cache-miss-key", body("withdrawal", "250.50"))
                .andExpect(status().isOk()));
        assertEquals(firstId, replayedId);

        create("cache-miss-key", body("withdrawal", "999"))
                .andExpect(status().isConflict());

        assertEquals(1, transactionRepository.count());
    }

    @Test
    void replayWhileRedisIsDown() throws Exception {
        String firstId = idOf(create("redis-down-key", body("disbursement", "40"))
                .andExpect(status().isCreated()));

        given(redisTemplate.opsForValue()).willThrow(new IllegalStateException("redis down"));

        String replayedId = idOf(create("redis-down-key", body("disbursement", "40"))
                .andExpect(status().isOk()));
        assertEquals(firstId, replayedId);
    }

    @Test
    void keyAlreadyRecordedRollsBackTheEffect() {
        idempotencyRecordRepository.saveAndFlush(IdempotencyRecordEntity.builder()
                .idempotencyKey("taken-key")
                .bodyHash(requestFingerprint.of("{}"))
                .responsePayload("{}")
                .createdAt(START)
                .updatedAt(START)
                .expiresAt(START.plus(Duration.ofHours(1)))
                .build());

        TransactionRequest request = TransactionRequest.builder()
                .type(TransactionType.PAYMENT)
                .amount(new BigDecimal("12000"))
                .consumerId(UUID.fromString(CONSUMER))
                .build();

        assertThrows(IdempotencyKeyTakenException.class, () -> idempotencyService.execute(
                "taken-key", requestFingerprint.of("other"),
                () -> transactionService.createTransaction(request, "taken-key")));

        assertEquals(0, transactionRepository.count());
        assertEquals(0, outboxEventRepository.count());
        assertEquals(1, idempotencyRecordRepository.count());
        assertFalse(redis.containsKey("idempotency:taken-key"));
    }

    @Test
    void failedOperationLeavesNothingBehind() {
        TransactionRequest request = TransactionRequest.builder()
                .type(TransactionType.PAYMENT)
                .amount(new BigDecimal("10"))
                .consumerId(UUID.fromString(CONSUMER))
                .build();

        IllegalStateException failure = assertThrows(IllegalStateException.class, () -> idempotencyService.execute(
                "failing-key", requestFingerprint.of("body"), () -> {
                    transactionService.createTransaction(request, "failing-key");
                    throw new IllegalStateException("downstream rejected");
                }));

        assertEquals("downstream rejected", failure.getMessage());
        assertEquals(0, transactionRepository.count());
        assertTrue(idempotencyRecordRepository.findByIdempotencyKey("failing-key").isEmpty());
        assertTrue(redis.isEmpty());
    }

    private ResultActions create(String key, String body) throws Exception {
        return mvc.perform(post("/api/v1/transactions")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private static String idOf(ResultActions result) throws Exception {
        return JsonPath.read(result.andReturn().getResponse().getContentAsString(), "$.data.id");
    }

    private static String body(String type, String amount) {
        return "{\"type\":\"" + type + "\",\"amount\":" + amount + ",\"consumerId\":\"" + CONSUMER + "\"}";
    }
}
