package com.fintech.idempotency.infrastructure.persistence.repository;

import com.fintech.idempotency.infrastructure.persistence.entity.IdempotencyRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecordEntity, UUID> {

    /**
     * Lookup by key only. Filtering by body hash here would hide conflicting
     * reuses of a key and let them be admitted a second time.
     */
    Optional<IdempotencyRecordEntity> findByIdempotencyKey(String idempotencyKey);
}
