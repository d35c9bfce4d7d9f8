package com.shopstream.state;

import lombok.Value;

/**
 * Declares a dimension table of the {@link KeyedStateStore}: latest record per key.
 *
 * @param <V> record type
 */
@Value
public class DimensionDescriptor<V> {

    String name;
    Class<V> type;
}
