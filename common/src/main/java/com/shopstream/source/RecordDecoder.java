package com.shopstream.source;

import java.io.IOException;

/**
 * Turns raw record bytes into a typed value and assigns its event time.
 *
 * @param <T> the decoded record type
 */
public interface RecordDecoder<T> {

    T decode(byte[] payload) throws IOException;

    /**
     * Event time of a decoded value in epoch milliseconds.
     *
     * @param value              the decoded value
     * @param transportTimestamp the timestamp assigned by the transport
     */
    long extractEventTime(T value, long transportTimestamp);
}
