package com.shopstream.source;

import com.shopstream.config.SourceConfig;

/**
 * Opens the partitioned log behind a configured source.
 */
@FunctionalInterface
public interface StreamSourceFactory {

    PartitionedStreamSource createSource(SourceConfig source);
}
