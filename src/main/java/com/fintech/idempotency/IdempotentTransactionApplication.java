package com.fintech.idempotency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Idempotent Transaction API
 *
 * Create-once transaction submission guarded by client-supplied idempotency keys.
 *
 * Architecture:
 * - Two-tier idempotency lookup (Redis cache, then PostgreSQL)
 * - Business write and idempotency record committed in one database transaction
 * - Unique constraint on the idempotency key as the admission race arbiter
 * - Transactional outbox for downstream TRANSACTION_CREATED events
 * - Circuit breaker around the cache tier
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
@EnableScheduling
public class IdempotentTransactionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdempotentTransactionApplication.class, args);
    }
}
