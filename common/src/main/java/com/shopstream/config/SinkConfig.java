package com.shopstream.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for the upsert sink writer.
 */
@Data
@NoArgsConstructor
public class SinkConfig {

    /** Maximum number of documents per bulk request. */
    private int batchSize = 500;

    /** Maximum time a document waits in a partially filled batch. */
    private long batchIntervalMs = 1_000;

    /** Write attempts per document before it is dead-lettered. */
    private int maxRetryAttempts = 5;

    private long initialBackoffMs = 200;

    private long maxBackoffMs = 10_000;

    /** JSON-lines file receiving documents that exhausted their retries. */
    private String deadLetterPath = "dead-letter/enriched-records.jsonl";

    /**
     * Once more documents than this have been dead-lettered, the sink is treated as
     * permanently unreachable and the pipeline stops.
     */
    private long deadLetterCapacity = 10_000;
}
