package com.shopstream.source;

/**
 * A source partition could not be read.  Transient: the worker retries with backoff and
 * the other sources keep flowing.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
