package com.walletscore.ingestion.adapter;

import com.walletscore.domain.PageRequest;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Explorer client using WebClient. Used by RetryingExplorerFetcher.
 */
public class WebClientExplorerClient implements ExplorerClient {

    private final WebClient webClient;
    private final String baseUrl;
    private final long chainId;

    public WebClientExplorerClient(WebClient.Builder builder, String baseUrl, long chainId) {
        this.webClient = builder.build();
        this.baseUrl = baseUrl;
        this.chainId = chainId;
    }

    @Override
    public Mono<String> fetchPage(PageRequest request, String apiKey) {
        return webClient.get()
                .uri(buildUri(request, apiKey))
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientException.class, e -> new ExplorerException(e.getMessage(), e));
    }

    URI buildUri(PageRequest request, String apiKey) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("chainid", chainId)
                .queryParam("module", "account")
                .queryParam("action", request.category().getAction())
                .queryParam("address", request.address())
                .queryParam("page", request.page())
                .queryParam("offset", request.pageSize())
                .queryParam("sort", request.sort().paramValue())
                .queryParam("apikey", apiKey)
                .encode()
                .build()
                .toUri();
    }
}
