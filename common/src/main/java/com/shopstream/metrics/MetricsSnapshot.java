package com.shopstream.metrics;

import com.shopstream.watermark.WatermarkHealth;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable read model of {@link PipelineMetrics} at one point in time.
 */
@Value
@Builder
public class MetricsSnapshot {

    long recordsIngested;
    long corruptRecords;
    long sourceFailures;

    long joinsStarted;
    long lateArrivals;
    long duplicateArrivals;
    long joinsEmittedMatched;
    long joinsEmittedUnmatched;
    long joinsForceFinalized;
    long factsEvicted;
    long pendingJoins;
    long bufferedFacts;

    long sinkWritten;
    long sinkRetried;
    long sinkDeadLettered;

    long checkpointsWritten;
    long checkpointsFailed;

    WatermarkHealth watermarks;
}
