package com.walletscore.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletscore.common.RateLimiter;
import com.walletscore.common.RetryPolicy;
import com.walletscore.common.Sleeper;
import com.walletscore.ingestion.adapter.ExplorerClient;
import com.walletscore.ingestion.adapter.RetryingExplorerFetcher;
import com.walletscore.ingestion.adapter.WebClientExplorerClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the explorer client, the process-wide explorer rate limiter and the retrying fetcher from
 * walletscore.ingestion.* properties.
 */
@Configuration
@EnableConfigurationProperties({ ExplorerProperties.class, IngestionRetryProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public ExplorerClient explorerClient(WebClient.Builder webClientBuilder, ExplorerProperties explorerProperties) {
        return new WebClientExplorerClient(webClientBuilder, explorerProperties.getBaseUrl(), explorerProperties.getChainId());
    }

    /** Single limiter for every explorer call: the upstream budget is per API key, not per wallet. */
    @Bean(name = "explorerRateLimiter")
    public RateLimiter explorerRateLimiter(ExplorerProperties explorerProperties) {
        return new RateLimiter(Duration.ofMillis(explorerProperties.getMinIntervalMs()));
    }

    @Bean
    public RetryPolicy explorerRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public RetryingExplorerFetcher retryingExplorerFetcher(
            ExplorerClient explorerClient,
            RateLimiter explorerRateLimiter,
            RetryPolicy explorerRetryPolicy,
            ObjectMapper objectMapper,
            ExplorerProperties explorerProperties
    ) {
        return new RetryingExplorerFetcher(
                explorerClient,
                explorerRateLimiter,
                explorerRetryPolicy,
                Sleeper.threadSleep(),
                objectMapper,
                Duration.ofSeconds(explorerProperties.getRequestTimeoutSeconds()));
    }
}
