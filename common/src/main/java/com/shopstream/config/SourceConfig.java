package com.shopstream.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for a single input stream.
 * Each source maps to one Kafka topic and is read by its own worker thread.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceConfig {

    /** Logical name used in checkpoints, logs and metrics (e.g. {@code views}). */
    private String name;

    private String topic;

    /**
     * How far the source watermark trails the highest event time seen.
     * {@code null} means unbounded tolerance: the source never produces late data and its
     * watermark follows the highest event time seen.
     */
    private Long allowedLatenessMs;

    /**
     * When set, a source that is fully caught up and silent for this long stops holding
     * back the global watermark.  {@code null} keeps it in the minimum forever.
     */
    private Long idleTimeoutMs;

    public boolean hasBoundedLateness() {
        return allowedLatenessMs != null;
    }
}
