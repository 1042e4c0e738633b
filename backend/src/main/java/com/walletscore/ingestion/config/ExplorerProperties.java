package com.walletscore.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chain-explorer (Etherscan v2 compatible) endpoint, credential and throttling settings.
 */
@ConfigurationProperties(prefix = "walletscore.ingestion.explorer")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ExplorerProperties {

    /** Explorer API endpoint. */
    @NotBlank
    private String baseUrl = "https://api.etherscan.io/v2/api";

    /**
     * Explorer API key. Blank is allowed at startup: every fetch then reports MISSING_CREDENTIAL
     * instead of calling upstream.
     */
    private String apiKey = "";

    /** EVM chain id sent as chainid (1 = Ethereum mainnet). */
    @Positive
    private long chainId = 1L;

    /** Minimum spacing between two explorer calls across the whole process. Free tier allows 3/sec. */
    @Positive
    private long minIntervalMs = 400L;

    /** Per-call timeout; a timed-out call counts as a malformed response and is retried. */
    @Positive
    private int requestTimeoutSeconds = 20;

    /** Threads fetching the activity lists of one request in parallel. */
    @Positive
    private int fetchThreads = 4;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
