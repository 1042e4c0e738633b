package com.walletscore.ingestion.adapter;

/**
 * Thrown when an explorer HTTP call fails before a body is received.
 */
public class ExplorerException extends RuntimeException {

    public ExplorerException(String message) {
        super(message);
    }

    public ExplorerException(String message, Throwable cause) {
        super(message, cause);
    }
}
