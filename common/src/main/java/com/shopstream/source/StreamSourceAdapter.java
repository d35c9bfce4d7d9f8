package com.shopstream.source;

import com.shopstream.config.SourceConfig;
import com.shopstream.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one input stream: decodes records, tracks read offsets and derives the source
 * watermark.
 *
 * <p>Watermark: {@code max(event time seen) - allowedLateness}, or the highest event time
 * seen when lateness is unbounded.  It never decreases.  Until the first record has been
 * seen the watermark is {@link Long#MIN_VALUE}.</p>
 *
 * <p>Not thread-safe: each adapter is owned by one {@link SourceWorker}.</p>
 */
@Slf4j
public class StreamSourceAdapter<T> {

    private final SourceConfig config;
    private final PartitionedStreamSource source;
    private final RecordDecoder<T> decoder;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private long maxEventTime = Long.MIN_VALUE;
    private long watermark = Long.MIN_VALUE;
    private long lastRecordAt;
    private int consecutiveFailures;
    private boolean idle;

    public StreamSourceAdapter(SourceConfig config, PartitionedStreamSource source,
                               RecordDecoder<T> decoder, PipelineMetrics metrics, Clock clock) {
        this.config = config;
        this.source = source;
        this.decoder = decoder;
        this.metrics = metrics;
        this.clock = clock;
        this.lastRecordAt = clock.millis();
    }

    public String getName() {
        return config.getName();
    }

    /**
     * Positions the source at the given offsets (partition → next offset to read) and
     * carries over a previously checkpointed watermark.
     */
    public void start(Map<Integer, Long> offsets, long restoredWatermark) {
        source.seek(offsets);
        watermark = Math.max(watermark, restoredWatermark);
        lastRecordAt = clock.millis();
        log.info("Source '{}' starting on topic={} with {} checkpointed partitions, watermark={}",
                getName(), source.getTopic(), offsets.size(), watermark);
    }

    /**
     * Polls the next batch.  A read failure does not propagate: it is reported as an
     * unavailable batch and the caller backs off.
     */
    public SourceBatch poll(Duration timeout) {
        List<RawRecord> raw;
        try {
            raw = source.poll(timeout);
        } catch (SourceUnavailableException e) {
            consecutiveFailures++;
            metrics.onSourceFailure();
            log.warn("Source '{}' unavailable (attempt {}): {}", getName(), consecutiveFailures, e.getMessage());
            return SourceBatch.unavailable(getName(), watermark, e.getMessage());
        }
        if (consecutiveFailures > 0) {
            log.info("Source '{}' available again after {} failed attempts", getName(), consecutiveFailures);
            consecutiveFailures = 0;
        }

        List<SourceRecord<?>> records = new ArrayList<>(raw.size());
        Map<Integer, Long> nextOffsets = new HashMap<>();
        for (RawRecord record : raw) {
            nextOffsets.merge(record.getPartition(), record.getOffset() + 1, Math::max);
            T value;
            try {
                value = decoder.decode(record.getValue());
            } catch (IOException | RuntimeException e) {
                metrics.onCorruptRecord();
                log.warn("Skipping undecodable record source={} partition={} offset={}: {}",
                        getName(), record.getPartition(), record.getOffset(), e.getMessage());
                continue;
            }
            long eventTime = decoder.extractEventTime(value, record.getTimestamp());
            observeEventTime(eventTime);
            records.add(new SourceRecord<>(getName(), record.getPartition(), record.getOffset(), eventTime, value));
        }

        long now = clock.millis();
        if (!raw.isEmpty()) {
            lastRecordAt = now;
        }
        updateIdleness(now);
        metrics.onRecordsIngested(records.size());
        return SourceBatch.of(getName(), records, nextOffsets, watermark, idle);
    }

    public long currentWatermark() {
        return watermark;
    }

    public boolean isIdle() {
        return idle;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void wakeup() {
        source.wakeup();
    }

    public void close() {
        source.close();
    }

    private void observeEventTime(long eventTime) {
        if (eventTime > maxEventTime) {
            maxEventTime = eventTime;
        }
        long candidate = config.hasBoundedLateness()
                ? saturatedSubtract(maxEventTime, config.getAllowedLatenessMs())
                : maxEventTime;
        if (candidate > watermark) {
            watermark = candidate;
        }
    }

    private void updateIdleness(long now) {
        Long idleTimeout = config.getIdleTimeoutMs();
        boolean nowIdle = idleTimeout != null
                && now - lastRecordAt >= idleTimeout
                && source.isCaughtUp();
        if (nowIdle != idle) {
            log.info("Source '{}' is now {}", getName(), nowIdle ? "idle" : "active");
            idle = nowIdle;
        }
    }

    private static long saturatedSubtract(long value, long delta) {
        long result = value - delta;
        return result > value ? Long.MIN_VALUE : result;
    }
}
