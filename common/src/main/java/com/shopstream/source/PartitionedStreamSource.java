package com.shopstream.source;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * An offset-addressable, partitioned record log (one topic).
 *
 * <p>Records are returned in per-partition order with monotonically increasing offsets.
 * Delivery is at-least-once: after a restart the same offsets may be read again.</p>
 */
public interface PartitionedStreamSource extends Closeable {

    String getTopic();

    /**
     * Sets the read position of every partition.  Partitions missing from
     * {@code startOffsets} are read from the earliest available offset.
     */
    void seek(Map<Integer, Long> startOffsets);

    /**
     * Returns the next records, waiting at most {@code timeout} when none are available.
     *
     * @throws SourceUnavailableException if the log cannot be read right now
     */
    List<RawRecord> poll(Duration timeout);

    /**
     * Whether every partition has been read up to its current end.
     * Returns {@code false} when this cannot be determined.
     */
    boolean isCaughtUp();

    /**
     * Aborts a blocking {@link #poll(Duration)} from another thread.
     */
    void wakeup();

    @Override
    void close();
}
