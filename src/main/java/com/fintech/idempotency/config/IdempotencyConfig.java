package com.fintech.idempotency.config;

import com.fintech.idempotency.domain.service.RequestFingerprint;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class IdempotencyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestFingerprint requestFingerprint() {
        return new RequestFingerprint();
    }
}
