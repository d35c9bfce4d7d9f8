package com.shopstream.metrics;

import com.shopstream.watermark.WatermarkHealth;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters and gauges of the enrichment pipeline.
 *
 * <p>Counters are updated from the worker, evaluation and sink threads; every field is an
 * atomic so that {@link #snapshot(WatermarkHealth)} can be taken from any thread.</p>
 */
public class PipelineMetrics {

    private final AtomicLong recordsIngested = new AtomicLong();
    private final AtomicLong corruptRecords = new AtomicLong();
    private final AtomicLong sourceFailures = new AtomicLong();

    private final AtomicLong joinsStarted = new AtomicLong();
    private final AtomicLong lateArrivals = new AtomicLong();
    private final AtomicLong duplicateArrivals = new AtomicLong();
    private final AtomicLong joinsEmittedMatched = new AtomicLong();
    private final AtomicLong joinsEmittedUnmatched = new AtomicLong();
    private final AtomicLong joinsForceFinalized = new AtomicLong();
    private final AtomicLong factsEvicted = new AtomicLong();
    private final AtomicLong pendingJoins = new AtomicLong();
    private final AtomicLong bufferedFacts = new AtomicLong();

    private final AtomicLong sinkWritten = new AtomicLong();
    private final AtomicLong sinkRetried = new AtomicLong();
    private final AtomicLong sinkDeadLettered = new AtomicLong();

    private final AtomicLong checkpointsWritten = new AtomicLong();
    private final AtomicLong checkpointsFailed = new AtomicLong();

    // ── Sources ──────────────────────────────────────────────────────────

    public void onRecordsIngested(int count) {
        recordsIngested.addAndGet(count);
    }

    public void onCorruptRecord() {
        corruptRecords.incrementAndGet();
    }

    public void onSourceFailure() {
        sourceFailures.incrementAndGet();
    }

    // ── Join ─────────────────────────────────────────────────────────────

    public void onJoinStarted() {
        joinsStarted.incrementAndGet();
    }

    public void onLateArrival() {
        lateArrivals.incrementAndGet();
    }

    public void onDuplicateArrival() {
        duplicateArrivals.incrementAndGet();
    }

    public void onJoinEmitted(boolean matched) {
        if (matched) {
            joinsEmittedMatched.incrementAndGet();
        } else {
            joinsEmittedUnmatched.incrementAndGet();
        }
    }

    public void onJoinForceFinalized() {
        joinsForceFinalized.incrementAndGet();
    }

    public void onFactsEvicted(int count) {
        factsEvicted.addAndGet(count);
    }

    public void setPendingJoins(long count) {
        pendingJoins.set(count);
    }

    public void setBufferedFacts(long count) {
        bufferedFacts.set(count);
    }

    // ── Sink ─────────────────────────────────────────────────────────────

    public void onSinkWritten(int count) {
        sinkWritten.addAndGet(count);
    }

    public void onSinkRetried(int count) {
        sinkRetried.addAndGet(count);
    }

    public void onSinkDeadLettered(int count) {
        sinkDeadLettered.addAndGet(count);
    }

    public long getSinkDeadLettered() {
        return sinkDeadLettered.get();
    }

    // ── Checkpoints ──────────────────────────────────────────────────────

    public void onCheckpointWritten() {
        checkpointsWritten.incrementAndGet();
    }

    public void onCheckpointFailed() {
        checkpointsFailed.incrementAndGet();
    }

    public MetricsSnapshot snapshot(WatermarkHealth watermarks) {
        return MetricsSnapshot.builder()
                .recordsIngested(recordsIngested.get())
                .corruptRecords(corruptRecords.get())
                .sourceFailures(sourceFailures.get())
                .joinsStarted(joinsStarted.get())
                .lateArrivals(lateArrivals.get())
                .duplicateArrivals(duplicateArrivals.get())
                .joinsEmittedMatched(joinsEmittedMatched.get())
                .joinsEmittedUnmatched(joinsEmittedUnmatched.get())
                .joinsForceFinalized(joinsForceFinalized.get())
                .factsEvicted(factsEvicted.get())
                .pendingJoins(pendingJoins.get())
                .bufferedFacts(bufferedFacts.get())
                .sinkWritten(sinkWritten.get())
                .sinkRetried(sinkRetried.get())
                .sinkDeadLettered(sinkDeadLettered.get())
                .checkpointsWritten(checkpointsWritten.get())
                .checkpointsFailed(checkpointsFailed.get())
                .watermarks(watermarks)
                .build();
    }
}
