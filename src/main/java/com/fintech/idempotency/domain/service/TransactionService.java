package com.fintech.idempotency.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.idempotency.domain.exception.InvalidTransactionQueryException;
import com.fintech.idempotency.domain.exception.TransactionsNotFoundException;
import com.fintech.idempotency.domain.model.TransactionRequest;
import com.fintech.idempotency.domain.model.TransactionResponse;
import com.fintech.idempotency.infrastructure.persistence.entity.OutboxEventEntity;
import com.fintech.idempotency.infrastructure.persistence.entity.TransactionEntity;
import com.fintech.idempotency.infrastructure.persistence.repository.OutboxEventRepository;
import com.fintech.idempotency.infrastructure.persistence.repository.TransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Transaction creation and listing.
 *
 * {@link #createTransaction} is the effect protected by the idempotency layer.
 * It must join the write-through transaction opened by {@link IdempotencyService}
 * so that the transaction row, its outbox event and the idempotency record
 * commit or roll back together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionService {

    static final Set<String> SORTABLE_FIELDS = Set.of("createdAt", "updatedAt", "amount", "type", "status");
    static final int MAX_PAGE_SIZE = 100;

    private final TransactionRepository transactionRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionResponse createTransaction(TransactionRequest request, String idempotencyKey) {
        TransactionEntity transaction = TransactionEntity.builder()
                .type(request.getType())
                .amount(request.getAmount())
                .status(TransactionEntity.TransactionStatus.PENDING)
                .consumerId(request.getConsumerId())
                .build();

        transaction = transactionRepository.save(transaction);
        TransactionResponse response = toResponse(transaction);

        // Transactional outbox: published only if the whole admission commits
        OutboxEventEntity outboxEvent = OutboxEventEntity.builder()
                .eventType(OutboxEventEntity.TRANSACTION_CREATED)
                .aggregateId(transaction.getId().toString())
                .idempotencyKey(idempotencyKey)
                .payload(toJson(response))
                .build();
        outboxEventRepository.save(outboxEvent);

        Counter.builder("transaction.created")
                .tag("type", request.getType().value())
                .register(meterRegistry)
                .increment();

        log.info("Transaction created: {} (type: {}, amount: {}, consumer: {})",
                transaction.getId(), request.getType().value(), request.getAmount(), request.getConsumerId());

        return response;
    }

    /**
     * List transactions, newest first by default.
     *
     * @param page 1-based page number
     * @param limit page size, at most {@value #MAX_PAGE_SIZE}
     * @param sortBy one of {@link #SORTABLE_FIELDS}
     * @param sortOrder asc or desc
     */
    @Transactional(readOnly = true)
    public List<TransactionResponse> listTransactions(int page, int limit, String sortBy, String sortOrder) {
        if (page < 1) {
            throw new InvalidTransactionQueryException("page must be greater than or equal to 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidTransactionQueryException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (!SORTABLE_FIELDS.contains(sortBy)) {
            throw new InvalidTransactionQueryException("sortBy must be one of " + SORTABLE_FIELDS);
        }
        Sort.Direction direction = Sort.Direction.fromOptionalString(sortOrder == null ? null : sortOrder.toUpperCase(Locale.ROOT))
                .orElseThrow(() -> new InvalidTransactionQueryException("sortOrder must be asc or desc"));

        List<TransactionResponse> transactions = transactionRepository
                .findAll(PageRequest.of(page - 1, limit, Sort.by(direction, sortBy)))
                .map(TransactionService::toResponse)
                .getContent();

        if (transactions.isEmpty()) {
            throw new TransactionsNotFoundException();
        }
        return transactions;
    }

    static TransactionResponse toResponse(TransactionEntity entity) {
        return TransactionResponse.builder()
                .id(entity.getId())
                .type(entity.getType())
                .amount(entity.getAmount())
                .status(entity.getStatus().value())
                .consumerId(entity.getConsumerId())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private String toJson(TransactionResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transaction event", e);
        }
    }
}
