package com.shopstream.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for periodic state checkpoints.
 */
@Data
@NoArgsConstructor
public class CheckpointConfig {

    /** Interval between periodic checkpoints (default: 30 seconds). */
    private long intervalMs = 30_000;

    /** Directory holding checkpoint payloads and the latest pointer. */
    private String location = "checkpoints";

    /** Number of complete checkpoints kept on disk as fallbacks. */
    private int retainedCheckpoints = 3;

    /** Attempts per checkpoint write before giving up on that checkpoint. */
    private int maxWriteAttempts = 3;

    /** Delay before the first write retry; doubles on each further attempt. */
    private long retryBackoffMs = 1_000;
}
