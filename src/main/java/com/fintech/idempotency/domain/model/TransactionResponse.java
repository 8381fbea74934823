package com.fintech.idempotency.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Transaction as returned to clients and recorded for replay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private UUID id;
    private TransactionType type;
    private BigDecimal amount;
    private String status;
    private UUID consumerId;
    private Instant createdAt;
    private Instant updatedAt;
}
