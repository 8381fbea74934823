package com.fintech.idempotency.domain.model;

import java.util.Locale;

/**
 * Where an idempotency record was found.
 */
public enum LookupTier {
    CACHE,
    DATABASE,
    NONE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
