package com.walletscore.ingestion.adapter;

import com.walletscore.domain.ActivityCategory;
import com.walletscore.domain.PageRequest;
import com.walletscore.domain.SortOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientExplorerClientTest {

    private static final String BASE_URL = "https://api.etherscan.io/v2/api";
    private static final String WALLET = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";

    @Test
    @DisplayName("GET carries chain, module, action, paging, sort and key parameters")
    void buildsAccountQuery() {
        AtomicReference<URI> seen = new AtomicReference<>();
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> {
                    seen.set(req.url());
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header("Content-Type", "application/json")
                            .body("{\"status\":\"1\",\"message\":\"OK\",\"result\":[]}")
                            .build());
                });
        WebClientExplorerClient client = new WebClientExplorerClient(builder, BASE_URL, 1L);

        String body = client.fetchPage(PageRequest.windowPage(ActivityCategory.TOKEN, WALLET, 3, SortOrder.DESC), "k1")
                .block();

        assertThat(body).contains("\"status\":\"1\"");
        UriComponents uri = UriComponentsBuilder.fromUri(seen.get()).build();
        assertThat(uri.getHost()).isEqualTo("api.etherscan.io");
        assertThat(uri.getQueryParams().getFirst("chainid")).isEqualTo("1");
        assertThat(uri.getQueryParams().getFirst("module")).isEqualTo("account");
        assertThat(uri.getQueryParams().getFirst("action")).isEqualTo("tokentx");
        assertThat(uri.getQueryParams().getFirst("address")).isEqualTo(WALLET);
        assertThat(uri.getQueryParams().getFirst("page")).isEqualTo("3");
        assertThat(uri.getQueryParams().getFirst("offset")).isEqualTo("1000");
        assertThat(uri.getQueryParams().getFirst("sort")).isEqualTo("desc");
        assertThat(uri.getQueryParams().getFirst("apikey")).isEqualTo("k1");
    }

    @Test
    @DisplayName("HTTP error status surfaces as ExplorerException")
    void httpErrorMapped() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY)
                        .body("bad gateway")
                        .build()));
        WebClientExplorerClient client = new WebClientExplorerClient(builder, BASE_URL, 1L);

        StepVerifier.create(client.fetchPage(PageRequest.firstActivity(WALLET), "k1"))
                .expectError(ExplorerException.class)
                .verify();
    }
}
