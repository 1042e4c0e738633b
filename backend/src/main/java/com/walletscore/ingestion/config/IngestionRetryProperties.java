package com.walletscore.ingestion.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Explorer retry policy (exponential backoff, optional jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "walletscore.ingestion.retry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Delay after the first failed attempt; doubles with each further attempt. Default 800. */
    @PositiveOrZero
    private long baseDelayMs = 800L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0, i.e. the exact exponential schedule. */
    @PositiveOrZero
    private double jitterFactor = 0.0;

    /** Max attempts including the first call. Default 6. */
    @Positive
    private int maxAttempts = 6;
}
