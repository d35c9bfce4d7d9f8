package com.shopstream.state;

import lombok.Value;

/**
 * Declares a fact buffer of the {@link KeyedStateStore}: facts per join key, in arrival
 * order, together with how the store may evict them as the watermark advances.
 *
 * @param <F> fact type
 */
@Value
public class FactBufferDescriptor<F extends FactEvent> {

    /**
     * How the store treats facts that fall behind {@code watermark + horizon}.
     */
    public enum Retention {
        /** Never evicted by the store; the owner drains the buffer. */
        DRAINED_BY_OWNER,
        /** Per key, only the newest fact behind the horizon survives. */
        KEEP_LATEST_BEHIND,
        /**
         * Every fact behind the horizon is dropped; with no horizon nothing is.  Such buffers
         * hold bookkeeping markers and are not counted against the store's capacity.
         */
        EXPIRE_BEHIND
    }

    String name;
    Class<F> type;
    Retention retention;
    /**
     * Facts with event time before {@code watermark + horizon} are behind the horizon.  May
     * be negative.
     * {@code null} means an infinite horizon: every fact is behind it.
     */
    Long horizonMs;

    /**
     * A buffer the store never evicts on its own; the owner drains it.
     */
    public static <F extends FactEvent> FactBufferDescriptor<F> drainedByOwner(String name, Class<F> type) {
        return new FactBufferDescriptor<>(name, type, Retention.DRAINED_BY_OWNER, null);
    }

    /**
     * A buffer where, per key, only the newest fact behind the horizon survives eviction.
     * Facts ahead of the horizon are always kept.
     */
    public static <F extends FactEvent> FactBufferDescriptor<F> keepLatestBehind(String name, Class<F> type,
                                                                                Long horizonMs) {
        return new FactBufferDescriptor<>(name, type, Retention.KEEP_LATEST_BEHIND, horizonMs);
    }

    /**
     * A buffer of markers that are dropped as soon as they fall behind the horizon.  A
     * {@code null} horizon keeps them forever.
     */
    public static <F extends FactEvent> FactBufferDescriptor<F> expireBehind(String name, Class<F> type,
                                                                            Long horizonMs) {
        return new FactBufferDescriptor<>(name, type, Retention.EXPIRE_BEHIND, horizonMs);
    }

    public boolean isEvictable() {
        if (retention == Retention.EXPIRE_BEHIND) {
            return horizonMs != null;
        }
        return retention != Retention.DRAINED_BY_OWNER;
    }

    /** Whether facts of this buffer count against the store's capacity. */
    public boolean isCapacityBound() {
        return retention != Retention.EXPIRE_BEHIND;
    }

    long cutoff(long watermark) {
        if (horizonMs == null) {
            return Long.MAX_VALUE;
        }
        long cutoff = watermark + horizonMs;
        if (horizonMs > 0 && cutoff < watermark) {
            return Long.MAX_VALUE;
        }
        if (horizonMs < 0 && cutoff > watermark) {
            return Long.MIN_VALUE;
        }
        return cutoff;
    }
}
