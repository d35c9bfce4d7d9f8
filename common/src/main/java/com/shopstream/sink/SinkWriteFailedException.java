package com.shopstream.sink;

/**
 * A write to the sink failed.  Transient: retried with backoff, then dead-lettered.
 */
public class SinkWriteFailedException extends RuntimeException {

    public SinkWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
