package com.fintech.idempotency.domain.service;

import com.fintech.idempotency.domain.model.IdempotencyRecord;

/**
 * Volatile copy of committed idempotency records.
 *
 * Never the source of truth: implementations may lose entries at any time and
 * must not propagate write failures.
 */
public interface IdempotencyCache extends IdempotencyRecordLookup {

    void put(IdempotencyRecord record);
}
