package com.shopstream.sink;

import java.io.Closeable;

/**
 * Receives documents the sink would not accept within the retry budget.
 */
public interface DeadLetterWriter extends Closeable {

    void write(SinkDocument document, String reason);

    @Override
    void close();
}
