package com.shopstream.sink;

/**
 * The sink has rejected more documents than the dead-letter output may absorb.  Needs an
 * operator; the pipeline stops and resumes from its last checkpoint once restarted.
 */
public class SinkUnavailableException extends RuntimeException {

    public SinkUnavailableException(String message) {
        super(message);
    }
}
