package com.fintech.idempotency.domain.service;

import com.fintech.idempotency.domain.model.IdempotencyRecord;
import com.fintech.idempotency.domain.model.LookupTier;

import java.util.Optional;

/**
 * One tier of the idempotency record lookup.
 *
 * Tiers are consulted in a fixed order (cache, then database) and all return
 * the same record shape, so the coordinator's comparison logic is tier-agnostic.
 * Implementations look records up by key only; hash comparison is the caller's job.
 */
public interface IdempotencyRecordLookup {

    LookupTier tier();

    Optional<IdempotencyRecord> find(String idempotencyKey);
}
