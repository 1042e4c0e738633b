package com.walletscore.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Feature snapshot cache. Only affects latency and upstream call volume: results are the same with it off.
 */
@ConfigurationProperties(prefix = "walletscore.cache")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    /** When false, every request recomputes from the explorer. */
    private boolean enabled = true;

    /** Entry lifetime in seconds. */
    @Positive
    private long ttlSeconds = 300L;

    /** Upper bound on cached (wallet, profile, window, offset) entries. */
    @Positive
    private long maximumSize = 1_000L;
}
