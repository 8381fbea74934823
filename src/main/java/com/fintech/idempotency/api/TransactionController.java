package com.fintech.idempotency.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.idempotency.config.IdempotencyProperties;
import com.fintech.idempotency.domain.exception.InvalidTransactionRequestException;
import com.fintech.idempotency.domain.model.IdempotentOutcome;
import com.fintech.idempotency.domain.model.TransactionRequest;
import com.fintech.idempotency.domain.model.TransactionResponse;
import com.fintech.idempotency.domain.service.IdempotentRequestHandler;
import com.fintech.idempotency.domain.service.TransactionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * REST API for transactions.
 *
 * Creation is idempotent: the {@code Idempotency-Key} header (name configurable)
 * identifies one logical attempt, and retries with the same key and body get the
 * original response back instead of a second transaction.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final IdempotentRequestHandler idempotentRequestHandler;
    private final TransactionService transactionService;
    private final IdempotencyProperties idempotencyProperties;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * Create a transaction.
     *
     * POST /api/v1/transactions
     *
     * 201 on first execution, 200 on replay, 409 when the key was used with a
     * different body, 419 when the key is past its validity window.
     *
     * The fingerprint covers the submitted JSON as sent: every field, including
     * ones the transaction ignores, in the client's key order.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<JsonNode>> createTransaction(@RequestBody String rawBody,
                                                                   HttpServletRequest httpRequest)
            throws JsonProcessingException {
        String idempotencyKey = httpRequest.getHeader(idempotencyProperties.headerName());
        log.info("Received transaction request (key: {})", idempotencyKey);

        JsonNode submitted = readBody(rawBody);
        TransactionRequest request = bind(submitted);
        byte[] body = objectMapper.writeValueAsBytes(submitted);

        IdempotentOutcome outcome = idempotentRequestHandler.handle(
                httpRequest.getMethod(), idempotencyKey, body,
                () -> transactionService.createTransaction(request, idempotencyKey));

        JsonNode data = objectMapper.readTree(outcome.getResponsePayload());
        if (outcome.isReplayed()) {
            return ResponseEntity.ok(
                    ApiResponse.success("Transaction already processed", data, httpRequest.getRequestURI()));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Transaction created successfully", data, httpRequest.getRequestURI()));
    }

    /**
     * GET /api/v1/transactions?page=1&limit=10&sortBy=createdAt&sortOrder=desc
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<TransactionResponse>>> getTransactions(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder,
            HttpServletRequest httpRequest) {

        List<TransactionResponse> transactions = transactionService.listTransactions(page, limit, sortBy, sortOrder);
        return ResponseEntity.ok(
                ApiResponse.success("Transactions fetched successfully", transactions, httpRequest.getRequestURI()));
    }

    private JsonNode readBody(String rawBody) {
        try {
            JsonNode submitted = objectMapper.readTree(rawBody);
            if (submitted == null || !submitted.isObject()) {
                throw new InvalidTransactionRequestException(List.of("Request body must be a JSON object"));
            }
            return submitted;
        } catch (JsonProcessingException e) {
            throw new InvalidTransactionRequestException("Request body is missing or malformed", e);
        }
    }

    private TransactionRequest bind(JsonNode submitted) {
        TransactionRequest request;
        try {
            request = objectMapper.treeToValue(submitted, TransactionRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidTransactionRequestException("Request body is missing or malformed", e);
        }

        Set<ConstraintViolation<TransactionRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new InvalidTransactionRequestException(violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .toList());
        }
        return request;
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
