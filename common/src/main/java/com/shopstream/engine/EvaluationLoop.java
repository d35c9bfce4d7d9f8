package com.shopstream.engine;

import com.shopstream.checkpoint.Checkpoint;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.sink.OutputChannel;
import com.shopstream.source.SourceBatch;
import com.shopstream.source.SourceRecord;
import com.shopstream.state.KeyedStateStore;
import com.shopstream.watermark.WatermarkCoordinator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The single writer of the pipeline.  Takes batches off the ingestion queue, hands their
 * records to the {@link StreamProcessor}, advances read offsets and the global watermark,
 * evicts facts behind the watermark and captures checkpoints between batches.
 *
 * <p>Because capture happens on this thread, a checkpoint's offsets, state and
 * unacknowledged outputs always describe the same point in the input.</p>
 */
@Slf4j
public class EvaluationLoop implements Runnable {

    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<SourceBatch> queue;
    private final StreamProcessor processor;
    private final KeyedStateStore store;
    private final WatermarkCoordinator watermarks;
    private final OutputChannel<?> output;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Consumer<Checkpoint> checkpointHandler;

    private final Map<String, Map<Integer, Long>> offsets = new HashMap<>();
    private final AtomicBoolean checkpointRequested = new AtomicBoolean();
    private volatile boolean running = true;
    private volatile boolean finishing;

    public EvaluationLoop(BlockingQueue<SourceBatch> queue, StreamProcessor processor, KeyedStateStore store,
                          WatermarkCoordinator watermarks, OutputChannel<?> output, PipelineMetrics metrics,
                          Clock clock, Consumer<Checkpoint> checkpointHandler) {
        this.queue = queue;
        this.processor = processor;
        this.store = store;
        this.watermarks = watermarks;
        this.output = output;
        this.metrics = metrics;
        this.clock = clock;
        this.checkpointHandler = checkpointHandler;
    }

    @Override
    public void run() {
        log.info("Evaluation loop started at globalWatermark={}", watermarks.getGlobalWatermark());
        try {
            while (running) {
                SourceBatch batch = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (batch != null) {
                    apply(batch);
                } else if (finishing) {
                    break;
                }
                if (checkpointRequested.compareAndSet(true, false)) {
                    checkpointHandler.accept(captureCheckpoint());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Evaluation loop interrupted with {} batches queued", queue.size());
        }
        log.info("Evaluation loop stopped at globalWatermark={}", watermarks.getGlobalWatermark());
    }

    /**
     * Applies one batch: records first, against the watermark as it stood before the
     * batch, then offsets and watermark.
     */
    public void apply(SourceBatch batch) throws InterruptedException {
        long before = watermarks.getGlobalWatermark();
        for (SourceRecord<?> record : batch.getRecords()) {
            processor.process(record, before);
        }
        if (!batch.getNextOffsets().isEmpty()) {
            Map<Integer, Long> sourceOffsets = offsets.computeIfAbsent(batch.getSource(), s -> new HashMap<>());
            batch.getNextOffsets().forEach((partition, next) -> sourceOffsets.merge(partition, next, Math::max));
        }
        long global = watermarks.onBatch(batch);
        if (global > before) {
            processor.onWatermark(global);
            metrics.onFactsEvicted(store.evictOlderThan(global));
        }
        metrics.setBufferedFacts(store.getBufferedFactCount());
        metrics.setPendingJoins(processor.pendingCount());
    }

    /**
     * Asks the loop to capture a checkpoint after the batch it is working on.
     */
    public void requestCheckpoint() {
        checkpointRequested.set(true);
    }

    /**
     * Copies offsets, watermarks, state and unacknowledged outputs.  Must run on the loop
     * thread, or after the loop has stopped.
     */
    public Checkpoint captureCheckpoint() {
        Map<String, Map<Integer, Long>> offsetCopy = new HashMap<>();
        offsets.forEach((source, partitions) -> offsetCopy.put(source, new HashMap<>(partitions)));
        return Checkpoint.builder()
                .createdAt(clock.millis())
                .offsets(offsetCopy)
                .sourceWatermarks(watermarks.sourceWatermarks())
                .globalWatermark(watermarks.getGlobalWatermark())
                .state(store.snapshot())
                .pendingOutputs(new ArrayList<>(output.unacked()))
                .build();
    }

    /**
     * Seeds the read positions from a restored checkpoint.
     */
    public void restoreOffsets(Map<String, Map<Integer, Long>> restored) {
        offsets.clear();
        restored.forEach((source, partitions) -> offsets.put(source, new HashMap<>(partitions)));
    }

    public Map<Integer, Long> offsetsOf(String source) {
        return new HashMap<>(offsets.getOrDefault(source, Map.of()));
    }

    /**
     * Lets the loop exit once the ingestion queue is empty.
     */
    public void finish() {
        finishing = true;
    }

    /**
     * Makes the loop exit after the current batch, leaving queued batches unapplied.
     */
    public void stop() {
        running = false;
    }
}
