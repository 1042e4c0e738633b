package com.walletscore.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletscore.common.RateLimiter;
import com.walletscore.common.RetryPolicy;
import com.walletscore.ingestion.adapter.ExplorerClient;
import com.walletscore.ingestion.adapter.RetryingExplorerFetcher;
import com.walletscore.ingestion.adapter.WebClientExplorerClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionAdapterConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(IngestionAdapterConfig.class)
            .withBean(WebClient.Builder.class, WebClient::builder)
            .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    void defaults_wireExplorerStack() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(RetryingExplorerFetcher.class);
            assertThat(ctx.getBean(ExplorerClient.class)).isInstanceOf(WebClientExplorerClient.class);
            assertThat(ctx.getBean(RateLimiter.class).getMinInterval()).isEqualTo(Duration.ofMillis(400));
            assertThat(ctx.getBean(RetryPolicy.class).getMaxAttempts()).isEqualTo(6);
            assertThat(ctx.getBean(ExplorerProperties.class).hasApiKey()).isFalse();
        });
    }

    @Test
    void properties_overrideDefaults() {
        runner.withPropertyValues(
                        "walletscore.ingestion.explorer.api-key=abc",
                        "walletscore.ingestion.explorer.min-interval-ms=250",
                        "walletscore.ingestion.retry.max-attempts=3")
                .run(ctx -> {
                    assertThat(ctx.getBean(ExplorerProperties.class).hasApiKey()).isTrue();
                    assertThat(ctx.getBean(RateLimiter.class).getMinInterval()).isEqualTo(Duration.ofMillis(250));
                    assertThat(ctx.getBean(RetryPolicy.class).getMaxAttempts()).isEqualTo(3);
                });
    }
}
