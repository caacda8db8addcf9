package com.contractbridge.core.sync;

/**
 * Thrown when a provider repository cannot be fetched (unreachable remote, failed clone,
 * timeout). Sync falls back to the cached contract when one exists.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
