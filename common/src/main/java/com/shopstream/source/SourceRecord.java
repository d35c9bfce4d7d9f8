package com.shopstream.source;

import lombok.Value;

/**
 * A decoded record together with its position in the source and its event time.
 *
 * @param <T> the decoded record type
 */
@Value
public class SourceRecord<T> {

    String source;
    int partition;
    long offset;
    long eventTime;
    T value;
}
