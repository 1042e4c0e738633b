package com.walletscore.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletscore.common.RateLimiter;
import com.walletscore.common.RetryPolicy;
import com.walletscore.common.Sleeper;
import com.walletscore.domain.PageRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;

/**
 * Issues one explorer page request through the shared rate limiter and retries transient failures
 * (malformed body, rate limit) with exponential backoff. Never throws: the caller always gets a classified
 * {@link ExplorerResponse}, a synthetic RETRIES_EXHAUSTED one once the attempt budget is spent.
 */
@Slf4j
public class RetryingExplorerFetcher {

    static final String NO_TRANSACTIONS_MESSAGE = "No transactions found";

    private final ExplorerClient client;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public RetryingExplorerFetcher(
            ExplorerClient client,
            RateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            ObjectMapper objectMapper,
            Duration requestTimeout
    ) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    public ExplorerResponse fetch(PageRequest request, String apiKey) {
        String lastError = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            rateLimiter.acquire();
            ExplorerResponse response = callOnce(request, apiKey);
            if (!response.outcome().isTransient()) {
                if (response.outcome() == ExplorerOutcome.FATAL) {
                    log.warn("Explorer {} page {} for {} failed, not retrying: {}",
                            request.category().getAction(), request.page(), request.address(), response.error());
                }
                return response;
            }
            lastError = response.error();
            if (attempt < maxAttempts) {
                long delayMs = retryPolicy.delayMs(attempt - 1);
                log.warn("Explorer {} page {} for {} attempt {}/{} {}; retrying in {} ms",
                        request.category().getAction(), request.page(), request.address(),
                        attempt, maxAttempts, response.outcome(), delayMs);
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ExplorerResponse.retriesExhausted("interrupted during backoff after: " + lastError);
                }
            }
        }
        log.warn("Explorer {} page {} for {} gave up after {} attempts: {}",
                request.category().getAction(), request.page(), request.address(), maxAttempts, lastError);
        return ExplorerResponse.retriesExhausted(lastError);
    }

    private ExplorerResponse callOnce(PageRequest request, String apiKey) {
        String body;
        try {
            body = client.fetchPage(request, apiKey).block(requestTimeout);
        } catch (RuntimeException e) {
            return ExplorerResponse.malformed("request_exception: " + e.getMessage());
        }
        return classify(body, objectMapper);
    }

    /**
     * Resolves a raw body into an outcome. Order matters: parse failure, success, empty history,
     * rate limit, then everything else is fatal.
     */
    static ExplorerResponse classify(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return ExplorerResponse.malformed("empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return ExplorerResponse.malformed("unparseable response body: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ExplorerResponse.malformed("response body is not a JSON object");
        }
        String status = root.path("status").asText("");
        String message = root.path("message").asText("");
        JsonNode result = root.path("result");

        if ("1".equals(status) && "OK".equalsIgnoreCase(message)) {
            return ExplorerResponse.success(status, message, result);
        }
        if ("0".equals(status) && NO_TRANSACTIONS_MESSAGE.equalsIgnoreCase(message.strip())) {
            return ExplorerResponse.success(status, message, objectMapper.createArrayNode());
        }
        String resultText = resultText(result);
        String combined = (message + " " + resultText).toLowerCase(Locale.ROOT);
        if (combined.contains("rate limit") || combined.contains("max calls per sec")) {
            return ExplorerResponse.rateLimited(status, message, resultText);
        }
        return ExplorerResponse.fatal(status, message, resultText);
    }

    private static String resultText(JsonNode result) {
        if (result == null || result.isMissingNode() || result.isNull()) {
            return "";
        }
        return result.isTextual() ? result.asText() : result.toString();
    }
}
