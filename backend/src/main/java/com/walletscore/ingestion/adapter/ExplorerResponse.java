package com.walletscore.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Explorer envelope {status, message, result} resolved to an outcome right after the call.
 * result is only meaningful on SUCCESS; error carries the text reported for any other outcome.
 */
public record ExplorerResponse(ExplorerOutcome outcome, String status, String message, JsonNode result, String error) {

    public static ExplorerResponse success(String status, String message, JsonNode result) {
        return new ExplorerResponse(ExplorerOutcome.SUCCESS, status, message, result, null);
    }

    public static ExplorerResponse rateLimited(String status, String message, String resultText) {
        return new ExplorerResponse(ExplorerOutcome.RATE_LIMITED, status, message, MissingNode.getInstance(),
                "rate_limited: " + message + " / " + resultText);
    }

    public static ExplorerResponse malformed(String error) {
        return new ExplorerResponse(ExplorerOutcome.MALFORMED, null, null, MissingNode.getInstance(), error);
    }

    public static ExplorerResponse fatal(String status, String message, String resultText) {
        return new ExplorerResponse(ExplorerOutcome.FATAL, status, message, MissingNode.getInstance(),
                "status=" + status + ", message=" + message + ", result=" + resultText);
    }

    /**
     * Synthetic NOTOK response returned when every attempt hit a transient failure.
     */
    public static ExplorerResponse retriesExhausted(String lastError) {
        return new ExplorerResponse(ExplorerOutcome.RETRIES_EXHAUSTED, "0", "NOTOK", MissingNode.getInstance(),
                "Retries exhausted. Last error: " + lastError);
    }

    public boolean isSuccess() {
        return outcome == ExplorerOutcome.SUCCESS;
    }
}
