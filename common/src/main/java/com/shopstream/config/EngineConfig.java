package com.shopstream.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sizing and failure policy of the evaluation loop.
 */
@Data
@NoArgsConstructor
public class EngineConfig {

    /** Capacity (in batches) of the queue between source workers and the evaluation loop. */
    private int ingestionQueueCapacity = 64;

    /** Capacity (in records) of the queue between the evaluation loop and the sink writer. */
    private int outputQueueCapacity = 10_000;

    /** Upper bound on buffered facts (sales and pending views) held in keyed state. */
    private int maxBufferedFacts = 1_000_000;

    private CapacityPolicy capacityPolicy = CapacityPolicy.FAIL;

    /** A source without progress for longer than this is reported as stalled. */
    private long stallThresholdMs = 60_000;

    /** Interval of the health log line. */
    private long healthLogIntervalMs = 30_000;

    /** Upper bound on a graceful shutdown before in-flight work is abandoned. */
    private long shutdownGracePeriodMs = 30_000;

    private long sourceRetryInitialBackoffMs = 500;

    private long sourceRetryMaxBackoffMs = 30_000;
}
