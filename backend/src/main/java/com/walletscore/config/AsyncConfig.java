package com.walletscore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for explorer fetches. The native, internal, token and first-activity lookups of one
 * assessment run side by side here; every call still passes through the shared explorer rate limiter.
 */
@Configuration
public class AsyncConfig {

    public static final String EXPLORER_FETCH_EXECUTOR = "explorer-fetch-executor";

    @Bean(name = EXPLORER_FETCH_EXECUTOR)
    public Executor explorerFetchExecutor(@Value("${walletscore.ingestion.explorer.fetch-threads:4}") int threads) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, threads));
        e.setMaxPoolSize(Math.max(1, threads));
        e.setThreadNamePrefix("explorer-fetch-");
        e.initialize();
        return e;
    }
}
