package com.shopstream.sink;

import com.shopstream.config.SinkConfig;
import com.shopstream.engine.ExponentialBackoff;
import com.shopstream.engine.ShutdownSignal;
import com.shopstream.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains an {@link OutputChannel} into an {@link UpsertSink}.
 *
 * <p>Documents are batched until {@code batchSize} is reached or {@code batchIntervalMs}
 * has passed since the first one.  Failed documents are retried with exponential backoff;
 * after {@code maxRetryAttempts} they go to the dead-letter output.  Both outcomes
 * acknowledge the document.</p>
 *
 * <p>A shutdown during a retry backoff abandons the retry: the document stays
 * unacknowledged and is recovered from the checkpoint on the next start.</p>
 */
@Slf4j
public class UpsertSinkWriter<O extends SinkDocument> implements Runnable {

    private final OutputChannel<O> channel;
    private final UpsertSink sink;
    private final DeadLetterWriter deadLetters;
    private final SinkConfig config;
    private final PipelineMetrics metrics;
    private final ShutdownSignal shutdown;
    private final ExponentialBackoff backoff;

    private volatile boolean draining;
    private long deadLettered;

    public UpsertSinkWriter(OutputChannel<O> channel, UpsertSink sink, DeadLetterWriter deadLetters,
                            SinkConfig config, PipelineMetrics metrics, ShutdownSignal shutdown) {
        this.channel = channel;
        this.sink = sink;
        this.deadLetters = deadLetters;
        this.config = config;
        this.metrics = metrics;
        this.shutdown = shutdown;
        this.backoff = new ExponentialBackoff(config.getInitialBackoffMs(), config.getMaxBackoffMs());
    }

    @Override
    public void run() {
        log.info("Sink writer started: batchSize={} batchIntervalMs={}",
                config.getBatchSize(), config.getBatchIntervalMs());
        try {
            while (true) {
                List<O> batch = nextBatch();
                if (batch.isEmpty()) {
                    if (draining) {
                        break;
                    }
                    continue;
                }
                write(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sink writer interrupted with {} queued documents", channel.queued());
        }
        log.info("Sink writer stopped, {} documents unacknowledged", channel.unackedCount());
    }

    /**
     * Lets the writer exit once the queue is empty.  Called after the evaluation loop has
     * emitted its last record.
     */
    public void finish() {
        draining = true;
    }

    /**
     * Writes one batch, retrying failed documents and dead-lettering those that exhaust
     * their attempts.
     *
     * @throws SinkUnavailableException if the dead-letter capacity is exceeded
     */
    void write(List<O> batch) throws InterruptedException {
        List<O> pending = batch;
        for (int attempt = 1; ; attempt++) {
            List<O> failed = new ArrayList<>();
            List<String> reasons = new ArrayList<>();
            int written = 0;
            try {
                List<UpsertResult> results = sink.upsert(pending);
                for (int i = 0; i < pending.size(); i++) {
                    UpsertResult result = results.get(i);
                    if (result.isSuccess()) {
                        channel.ack(pending.get(i));
                        written++;
                    } else {
                        failed.add(pending.get(i));
                        reasons.add(result.getError());
                    }
                }
            } catch (SinkWriteFailedException e) {
                log.warn("Sink write of {} documents failed (attempt {}): {}",
                        pending.size(), attempt, e.getMessage());
                failed = pending;
                reasons.clear();
                String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
                for (int i = 0; i < pending.size(); i++) {
                    reasons.add(reason);
                }
            }
            metrics.onSinkWritten(written);
            if (failed.isEmpty()) {
                return;
            }
            if (attempt >= config.getMaxRetryAttempts()) {
                deadLetter(failed, reasons, attempt);
                return;
            }
            long delay = backoff.delayMs(attempt);
            metrics.onSinkRetried(failed.size());
            log.warn("Retrying {} documents in {} ms (attempt {}/{}), first error: {}",
                    failed.size(), delay, attempt, config.getMaxRetryAttempts(), reasons.get(0));
            if (!shutdown.sleep(delay)) {
                log.warn("Shutdown during sink retry, {} documents left for recovery", failed.size());
                return;
            }
            pending = failed;
        }
    }

    private List<O> nextBatch() throws InterruptedException {
        List<O> batch = new ArrayList<>();
        long wait = draining ? 0 : config.getBatchIntervalMs();
        O first = channel.poll(wait);
        if (first == null) {
            return batch;
        }
        batch.add(first);
        long deadline = System.currentTimeMillis() + config.getBatchIntervalMs();
        while (batch.size() < config.getBatchSize()) {
            long remaining = draining ? 0 : deadline - System.currentTimeMillis();
            O next = channel.poll(Math.max(remaining, 0));
            if (next == null) {
                break;
            }
            batch.add(next);
        }
        return batch;
    }

    private void deadLetter(List<O> failed, List<String> reasons, int attempts) {
        for (int i = 0; i < failed.size(); i++) {
            O document = failed.get(i);
            deadLetters.write(document, "failed after " + attempts + " attempts: " + reasons.get(i));
            channel.ack(document);
        }
        deadLettered += failed.size();
        metrics.onSinkDeadLettered(failed.size());
        if (deadLettered > config.getDeadLetterCapacity()) {
            throw new SinkUnavailableException("Dead-lettered " + deadLettered
                    + " documents, more than the capacity of " + config.getDeadLetterCapacity());
        }
    }
}
