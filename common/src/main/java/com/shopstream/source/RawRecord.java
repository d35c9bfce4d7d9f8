package com.shopstream.source;

import lombok.Value;

/**
 * A record as read from a partitioned stream, before decoding.
 */
@Value
public class RawRecord {

    int partition;
    long offset;
    /** Transport timestamp in epoch milliseconds, negative when the transport has none. */
    long timestamp;
    byte[] value;
}
