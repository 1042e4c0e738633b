package com.walletscore.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletscore.domain.ActivityCategory;
import com.walletscore.domain.ActivityRecord;
import com.walletscore.domain.FetchError;
import com.walletscore.domain.FetchErrorKind;
import com.walletscore.domain.PageRequest;
import com.walletscore.domain.SortOrder;
import com.walletscore.domain.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads one explorer account list page by page and keeps the rows inside a time window.
 * Paging stops on an empty page, a short page, or (descending order) a page that already reaches before the
 * window. Reaching the last allowed page while pages are still full marks the result truncated.
 * Any failed page aborts the whole list: no partial results.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WindowPaginator {

    private final RetryingExplorerFetcher fetcher;

    public WindowFetchResult fetchWindow(ActivityCategory category, String address, TimeWindow window, String apiKey) {
        return fetchWindow(category, address, window, SortOrder.DESC, apiKey);
    }

    public WindowFetchResult fetchWindow(ActivityCategory category, String address, TimeWindow window,
                                         SortOrder sort, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return WindowFetchResult.failed(missingCredential());
        }
        List<ActivityRecord> inWindow = new ArrayList<>();
        boolean truncated = false;

        for (int page = 1; page <= PageRequest.MAX_PAGES; page++) {
            PageRequest request = PageRequest.windowPage(category, address, page, sort);
            ExplorerResponse response = fetcher.fetch(request, apiKey);
            if (!response.isSuccess()) {
                return WindowFetchResult.failed(toFetchError(response));
            }
            JsonNode rows = response.result();
            if (!rows.isArray()) {
                return WindowFetchResult.failed(new FetchError(FetchErrorKind.UNEXPECTED_PAYLOAD,
                        "Unexpected result type for " + category.getAction() + ": " + rows.getNodeType()));
            }
            if (rows.isEmpty()) {
                break;
            }

            long minTs = Long.MAX_VALUE;
            for (JsonNode row : rows) {
                OptionalLong ts = parseTimestamp(row);
                if (ts.isEmpty()) {
                    continue;
                }
                minTs = Math.min(minTs, ts.getAsLong());
                if (window.contains(ts.getAsLong())) {
                    inWindow.add(toRecord(row, ts.getAsLong(), category));
                }
            }
            log.debug("Explorer {} page {} for {}: {} rows, {} in window so far",
                    category.getAction(), page, address, rows.size(), inWindow.size());

            if (sort == SortOrder.DESC && minTs != Long.MAX_VALUE && minTs < window.startTs()) {
                break;
            }
            if (rows.size() < request.pageSize()) {
                break;
            }
            if (page == PageRequest.MAX_PAGES) {
                truncated = true;
                log.info("Explorer {} for {} hit the {}-row ceiling; counts are a lower bound",
                        category.getAction(), address, PageRequest.RESULT_CEILING);
            }
        }
        return WindowFetchResult.of(inWindow, truncated);
    }

    /**
     * Oldest native transaction of the wallet, regardless of any window.
     */
    public FirstActivityResult fetchFirstActivity(String address, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return FirstActivityResult.failed(missingCredential());
        }
        ExplorerResponse response = fetcher.fetch(PageRequest.firstActivity(address), apiKey);
        if (!response.isSuccess()) {
            return FirstActivityResult.failed(toFetchError(response));
        }
        JsonNode rows = response.result();
        if (!rows.isArray() || rows.isEmpty()) {
            return FirstActivityResult.none();
        }
        OptionalLong ts = parseTimestamp(rows.get(0));
        return ts.isPresent() ? FirstActivityResult.found(ts.getAsLong()) : FirstActivityResult.none();
    }

    static OptionalLong parseTimestamp(JsonNode row) {
        JsonNode ts = row.path("timeStamp");
        if (ts.isMissingNode() || ts.isNull()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(ts.asText().strip()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static ActivityRecord toRecord(JsonNode row, long timestamp, ActivityCategory category) {
        boolean token = category == ActivityCategory.TOKEN;
        return new ActivityRecord(
                textOrNull(row, "hash"),
                timestamp,
                textOrNull(row, "from"),
                textOrNull(row, "to"),
                token ? textOrNull(row, "tokenSymbol") : null,
                token ? textOrNull(row, "contractAddress") : null,
                category);
    }

    private static String textOrNull(JsonNode row, String field) {
        JsonNode node = row.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    public static FetchError missingCredential() {
        return new FetchError(FetchErrorKind.MISSING_CREDENTIAL,
                "Missing explorer API key (set walletscore.ingestion.explorer.api-key or ETHERSCAN_API_KEY)");
    }

    private static FetchError toFetchError(ExplorerResponse response) {
        FetchErrorKind kind = response.outcome() == ExplorerOutcome.RETRIES_EXHAUSTED
                ? FetchErrorKind.RETRIES_EXHAUSTED
                : FetchErrorKind.FATAL_UPSTREAM;
        return new FetchError(kind, "Explorer error: " + response.error());
    }
}
