package com.shopstream.engine;

import com.shopstream.source.SourceRecord;

/**
 * Join logic driven by the {@link EvaluationLoop}.  All calls come from the loop thread.
 */
public interface StreamProcessor {

    /**
     * Applies one record.
     *
     * @param globalWatermark the global watermark before the record's batch was applied
     */
    void process(SourceRecord<?> record, long globalWatermark) throws InterruptedException;

    /**
     * Called after the global watermark has advanced, before facts behind it are evicted.
     */
    void onWatermark(long globalWatermark) throws InterruptedException;

    /**
     * Rebuilds any derived structures after the state store has been restored from a
     * checkpoint.
     */
    void onRestore();

    /** Number of joins waiting for more input or for the watermark. */
    int pendingCount();
}
