package com.walletscore.ingestion.activity;

import com.walletscore.config.AsyncConfig;
import com.walletscore.domain.ActivityCategory;
import com.walletscore.domain.FetchError;
import com.walletscore.domain.FetchErrorKind;
import com.walletscore.domain.TimeWindow;
import com.walletscore.ingestion.adapter.FirstActivityResult;
import com.walletscore.ingestion.adapter.WindowFetchResult;
import com.walletscore.ingestion.adapter.WindowPaginator;
import com.walletscore.ingestion.config.ExplorerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches the native, internal and token lists of one window plus the first-activity lookup concurrently.
 * Each task fails independently; an unexpected exception in one becomes a FETCH_FAILED error for that key only.
 * Without an API key nothing is scheduled and every key reports MISSING_CREDENTIAL.
 */
@Slf4j
@Component
public class WalletActivityFetcher {

    private final WindowPaginator paginator;
    private final ExplorerProperties explorerProperties;
    private final Executor executor;

    public WalletActivityFetcher(WindowPaginator paginator,
                                 ExplorerProperties explorerProperties,
                                 @Qualifier(AsyncConfig.EXPLORER_FETCH_EXECUTOR) Executor executor) {
        this.paginator = paginator;
        this.explorerProperties = explorerProperties;
        this.executor = executor;
    }

    public WalletActivity fetch(String wallet, TimeWindow window) {
        if (!explorerProperties.hasApiKey()) {
            log.warn("No explorer API key configured; skipping all lookups for {}", wallet);
            FetchError missing = WindowPaginator.missingCredential();
            return new WalletActivity(WindowFetchResult.failed(missing), WindowFetchResult.failed(missing),
                    WindowFetchResult.failed(missing), FirstActivityResult.failed(missing));
        }
        String apiKey = explorerProperties.getApiKey();

        CompletableFuture<WindowFetchResult> normal = fetchList(ActivityCategory.NATIVE, wallet, window, apiKey);
        CompletableFuture<WindowFetchResult> internal = fetchList(ActivityCategory.INTERNAL, wallet, window, apiKey);
        CompletableFuture<WindowFetchResult> token = fetchList(ActivityCategory.TOKEN, wallet, window, apiKey);
        CompletableFuture<FirstActivityResult> first = CompletableFuture
                .supplyAsync(() -> paginator.fetchFirstActivity(wallet, apiKey), executor)
                .exceptionally(ex -> {
                    log.error("First-activity lookup failed for {}", wallet, ex);
                    return FirstActivityResult.failed(fetchFailed(ex));
                });

        CompletableFuture.allOf(normal, internal, token, first).join();
        WalletActivity activity = new WalletActivity(normal.join(), internal.join(), token.join(), first.join());

        log.info("Fetched activity for {} window [{}, {}]: normal={}, internal={}, erc20={}, truncated={}, errors={}",
                wallet, window.startTs(), window.endTs(),
                activity.normal().records().size(),
                activity.internal().records().size(),
                activity.token().records().size(),
                activity.anyTruncated(),
                activity.errors().keySet());
        return activity;
    }

    private CompletableFuture<WindowFetchResult> fetchList(ActivityCategory category, String wallet,
                                                           TimeWindow window, String apiKey) {
        return CompletableFuture
                .supplyAsync(() -> paginator.fetchWindow(category, wallet, window, apiKey), executor)
                .exceptionally(ex -> {
                    log.error("Explorer {} fetch failed for {}", category.getAction(), wallet, ex);
                    return WindowFetchResult.failed(fetchFailed(ex));
                });
    }

    private static FetchError fetchFailed(Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        return new FetchError(FetchErrorKind.FETCH_FAILED, "Fetch failed: " + cause.getMessage());
    }
}
