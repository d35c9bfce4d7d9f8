package com.shopstream.watermark;

import com.shopstream.source.SourceBatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the per-source watermarks into one global low watermark:
 * {@code min(watermark of every non-idle source)}, clamped so it never moves backwards.
 *
 * <p>A source that stops making progress freezes the global watermark, and with it every
 * pending join.  That is the conservative behaviour, so it is surfaced through
 * {@link #health()} rather than worked around.</p>
 *
 * <p>Updated by the evaluation loop; {@link #health()} may be called from any thread.</p>
 */
@Slf4j
public class WatermarkCoordinator {

    private final Map<String, SourceState> sources = new LinkedHashMap<>();
    private final Clock clock;
    private final long stallThresholdMs;

    private volatile long globalWatermark = Long.MIN_VALUE;

    public WatermarkCoordinator(Collection<String> sourceNames, long stallThresholdMs, Clock clock) {
        this.clock = clock;
        this.stallThresholdMs = stallThresholdMs;
        long now = clock.millis();
        for (String name : sourceNames) {
            sources.put(name, new SourceState(now));
        }
    }

    /**
     * Applies the status carried by a batch and recomputes the global watermark.
     *
     * @return the (possibly unchanged) global watermark
     */
    public synchronized long onBatch(SourceBatch batch) {
        SourceState state = state(batch.getSource());
        long now = clock.millis();
        if (!batch.isAvailable()) {
            state.available = false;
            state.failure = batch.getFailure();
            return globalWatermark;
        }
        state.available = true;
        state.failure = null;
        state.idle = batch.isIdle();
        if (!batch.getRecords().isEmpty() || batch.getWatermark() > state.watermark) {
            state.lastProgressAt = now;
        }
        if (batch.getWatermark() > state.watermark) {
            state.watermark = batch.getWatermark();
        }
        return recompute();
    }

    public long getGlobalWatermark() {
        return globalWatermark;
    }

    public synchronized Map<String, Long> sourceWatermarks() {
        Map<String, Long> result = new HashMap<>();
        sources.forEach((name, state) -> result.put(name, state.watermark));
        return result;
    }

    /**
     * Reinstates checkpointed watermarks so that the global watermark stays monotonic
     * across a restart.
     */
    public synchronized void restore(Map<String, Long> sourceWatermarks, long global) {
        sourceWatermarks.forEach((name, watermark) -> {
            SourceState state = sources.get(name);
            if (state != null) {
                state.watermark = Math.max(state.watermark, watermark);
            }
        });
        if (global > globalWatermark) {
            globalWatermark = global;
        }
        log.info("Restored watermarks: global={} sources={}", globalWatermark, sourceWatermarks);
    }

    public synchronized WatermarkHealth health() {
        long now = clock.millis();
        List<WatermarkHealth.SourceStatus> statuses = new ArrayList<>();
        List<String> stalled = new ArrayList<>();
        for (Map.Entry<String, SourceState> entry : sources.entrySet()) {
            SourceState state = entry.getValue();
            boolean isStalled = !state.idle && now - state.lastProgressAt > stallThresholdMs;
            if (isStalled) {
                stalled.add(entry.getKey());
            }
            statuses.add(new WatermarkHealth.SourceStatus(entry.getKey(), state.watermark, state.idle,
                    state.available, state.lastProgressAt, isStalled, state.failure));
        }
        return new WatermarkHealth(globalWatermark, statuses, stalled);
    }

    private long recompute() {
        long min = Long.MAX_VALUE;
        boolean anyActive = false;
        for (SourceState state : sources.values()) {
            if (state.idle) {
                continue;
            }
            anyActive = true;
            min = Math.min(min, state.watermark);
        }
        if (anyActive && min > globalWatermark) {
            log.debug("Global watermark advanced {} -> {}", globalWatermark, min);
            globalWatermark = min;
        }
        return globalWatermark;
    }

    private SourceState state(String source) {
        SourceState state = sources.get(source);
        if (state == null) {
            throw new IllegalArgumentException("Unknown source: " + source);
        }
        return state;
    }

    private static final class SourceState {
        long watermark = Long.MIN_VALUE;
        boolean idle;
        boolean available = true;
        long lastProgressAt;
        String failure;

        SourceState(long now) {
            this.lastProgressAt = now;
        }
    }
}
