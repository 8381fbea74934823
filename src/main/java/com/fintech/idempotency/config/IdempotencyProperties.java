package com.fintech.idempotency.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Idempotency settings bound from {@code app.idempotency.*}.
 *
 * Passed explicitly to every component that needs it; decision logic never reads
 * the environment directly.
 */
@Validated
@ConfigurationProperties(prefix = "app.idempotency")
public record IdempotencyProperties(
        @NotBlank String headerName,         // e.g., Idempotency-Key
        @NotBlank String keyPrefix,          // e.g., idempotency -> "idempotency:<key>"
        @Min(1) Long ttlHours,               // validity window of a recorded response
        @NotEmpty Set<String> methods,       // methods eligible for protection
        @Min(1) Integer maxReconcileAttempts,
        @Min(1) Integer transactionTimeoutSeconds
) {

    public static final String DEFAULT_HEADER_NAME = "Idempotency-Key";
    public static final String DEFAULT_KEY_PREFIX = "idempotency";

    public IdempotencyProperties {
        headerName = headerName == null ? DEFAULT_HEADER_NAME : headerName;
        keyPrefix = keyPrefix == null ? DEFAULT_KEY_PREFIX : keyPrefix;
        ttlHours = ttlHours == null ? 1L : ttlHours;
        methods = methods == null || methods.isEmpty()
                ? Set.of("POST", "PUT", "PATCH")
                : methods.stream().map(m -> m.trim().toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        maxReconcileAttempts = maxReconcileAttempts == null ? 3 : maxReconcileAttempts;
        transactionTimeoutSeconds = transactionTimeoutSeconds == null ? 10 : transactionTimeoutSeconds;
    }

    public static IdempotencyProperties defaults() {
        return new IdempotencyProperties(null, null, null, null, null, null);
    }

    public Duration ttl() {
        return Duration.ofHours(ttlHours);
    }

    public boolean isProtectedMethod(String method) {
        return method != null && methods.contains(method.toUpperCase(Locale.ROOT));
    }

    public String cacheKey(String idempotencyKey) {
        return keyPrefix + ":" + idempotencyKey;
    }
}
