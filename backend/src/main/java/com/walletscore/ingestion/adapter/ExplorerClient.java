package com.walletscore.ingestion.adapter;

import com.walletscore.domain.PageRequest;
import reactor.core.publisher.Mono;

/**
 * Chain-explorer account API abstraction for testing. Throttling, retries and response classification are
 * handled by {@link RetryingExplorerFetcher}.
 */
public interface ExplorerClient {

    /**
     * Perform a single GET for one page of an account list.
     *
     * @param request page to read (action, address, page, offset, sort)
     * @param apiKey  explorer credential
     * @return raw response body; errors with {@link ExplorerException} on transport or HTTP failure
     */
    Mono<String> fetchPage(PageRequest request, String apiKey);
}
