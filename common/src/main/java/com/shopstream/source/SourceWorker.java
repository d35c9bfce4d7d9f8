package com.shopstream.source;

import com.shopstream.engine.ExponentialBackoff;
import com.shopstream.engine.ShutdownSignal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;

/**
 * Polls one {@link StreamSourceAdapter} and pushes its batches into the shared, bounded
 * ingestion queue.  A full queue blocks the worker, which is how backpressure from the
 * evaluation loop reaches the sources.
 *
 * <p>Empty polls are only forwarded when they change something the evaluation loop cares
 * about: availability, idleness or the watermark.</p>
 */
@Slf4j
public class SourceWorker implements Runnable {

    private final StreamSourceAdapter<?> adapter;
    private final BlockingQueue<SourceBatch> queue;
    private final Duration pollTimeout;
    private final ExponentialBackoff backoff;
    private final ShutdownSignal shutdown;

    private volatile boolean running = true;

    public SourceWorker(StreamSourceAdapter<?> adapter, BlockingQueue<SourceBatch> queue,
                        Duration pollTimeout, ExponentialBackoff backoff, ShutdownSignal shutdown) {
        this.adapter = adapter;
        this.queue = queue;
        this.pollTimeout = pollTimeout;
        this.backoff = backoff;
        this.shutdown = shutdown;
    }

    @Override
    public void run() {
        log.info("Source worker '{}' started", adapter.getName());
        boolean lastAvailable = true;
        boolean lastIdle = false;
        long lastWatermark = adapter.currentWatermark();
        try {
            while (running && !shutdown.isTriggered()) {
                SourceBatch batch = adapter.poll(pollTimeout);
                if (!batch.isAvailable()) {
                    if (lastAvailable) {
                        queue.put(batch);
                    }
                    lastAvailable = false;
                    long delay = backoff.delayMs(adapter.getConsecutiveFailures());
                    if (!shutdown.sleep(delay)) {
                        break;
                    }
                    continue;
                }
                boolean changed = !lastAvailable
                        || batch.isIdle() != lastIdle
                        || batch.getWatermark() != lastWatermark;
                if (!batch.isEmpty() || changed) {
                    queue.put(batch);
                }
                lastAvailable = true;
                lastIdle = batch.isIdle();
                lastWatermark = batch.getWatermark();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Source worker '{}' interrupted", adapter.getName());
        } catch (RuntimeException e) {
            log.error("Source worker '{}' failed", adapter.getName(), e);
            throw e;
        }
        log.info("Source worker '{}' stopped", adapter.getName());
    }

    /**
     * Asks the worker to finish its current poll and exit.
     */
    public void stop() {
        running = false;
        adapter.wakeup();
    }

    public String getName() {
        return adapter.getName();
    }
}
