package com.shopstream.checkpoint;

import com.shopstream.config.CheckpointConfig;
import com.shopstream.engine.ExponentialBackoff;
import com.shopstream.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists checkpoints and finds the newest usable one on startup.
 *
 * <p>{@link #persist(Checkpoint)} assigns the next version, writes it with retries and
 * prunes versions beyond the retention count.  {@link #restore()} walks from the latest
 * pointer to older versions until one decodes; when none does, the pipeline starts cold
 * and a data-loss warning is logged.</p>
 */
@Slf4j
public class CheckpointManager {

    private final CheckpointStore store;
    private final CheckpointCodec codec;
    private final CheckpointConfig config;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final ExponentialBackoff backoff;
    private final AtomicLong lastVersion = new AtomicLong();

    public CheckpointManager(CheckpointStore store, CheckpointCodec codec, CheckpointConfig config,
                             PipelineMetrics metrics, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.backoff = new ExponentialBackoff(config.getRetryBackoffMs(),
                config.getRetryBackoffMs() << Math.min(Math.max(config.getMaxWriteAttempts() - 1, 0), 16));
    }

    /**
     * Loads the newest valid checkpoint.
     *
     * @return the checkpoint, or empty for a cold start
     */
    public Optional<Checkpoint> restore() {
        List<Long> candidates = new ArrayList<>();
        try {
            OptionalLong latest = store.latestVersion();
            latest.ifPresent(candidates::add);
            for (Long version : store.listVersions()) {
                if (!candidates.contains(version)) {
                    candidates.add(version);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list checkpoints in " + config.getLocation(), e);
        }
        candidates.stream().mapToLong(Long::longValue).max()
                .ifPresent(max -> lastVersion.accumulateAndGet(max, Math::max));

        if (candidates.isEmpty()) {
            log.info("No checkpoint found in {}, starting from the earliest offsets", config.getLocation());
            return Optional.empty();
        }
        for (long version : candidates) {
            try {
                Checkpoint checkpoint = codec.decode(store.read(version));
                log.info("Restoring from checkpoint version={} createdAt={} globalWatermark={}",
                        version, checkpoint.getCreatedAt(), checkpoint.getGlobalWatermark());
                return Optional.of(checkpoint);
            } catch (CheckpointCorruptException e) {
                log.warn("Checkpoint version={} is corrupt, trying an older one: {}", version, e.getMessage());
            } catch (IOException e) {
                log.warn("Checkpoint version={} is unreadable, trying an older one: {}", version, e.getMessage());
            }
        }
        log.warn("DATA LOSS: none of the {} checkpoints in {} is valid; starting cold from the earliest offsets",
                candidates.size(), config.getLocation());
        return Optional.empty();
    }

    /**
     * Writes {@code checkpoint} as a new version.
     *
     * @return the version written
     * @throws CheckpointWriteFailedException when every attempt failed
     */
    public long persist(Checkpoint checkpoint) {
        long version = lastVersion.incrementAndGet();
        checkpoint.setVersion(version);
        if (checkpoint.getCreatedAt() == 0) {
            checkpoint.setCreatedAt(clock.millis());
        }
        byte[] payload = codec.encode(checkpoint);

        IOException lastError = null;
        for (int attempt = 1; attempt <= config.getMaxWriteAttempts(); attempt++) {
            try {
                store.write(version, payload);
                metrics.onCheckpointWritten();
                log.info("Checkpoint version={} written ({} bytes, {} pending outputs, globalWatermark={})",
                        version, payload.length, checkpoint.getPendingOutputs().size(),
                        checkpoint.getGlobalWatermark());
                prune();
                return version;
            } catch (IOException e) {
                lastError = e;
                log.warn("Checkpoint version={} write attempt {}/{} failed: {}",
                        version, attempt, config.getMaxWriteAttempts(), e.getMessage());
                if (attempt < config.getMaxWriteAttempts() && !sleep(backoff.delayMs(attempt))) {
                    break;
                }
            }
        }
        metrics.onCheckpointFailed();
        throw new CheckpointWriteFailedException("Checkpoint version=" + version + " could not be written", lastError);
    }

    public long getLastVersion() {
        return lastVersion.get();
    }

    private void prune() {
        try {
            List<Long> versions = store.listVersions();
            OptionalLong latest = store.latestVersion();
            int keep = Math.max(config.getRetainedCheckpoints(), 1);
            for (int i = keep; i < versions.size(); i++) {
                long version = versions.get(i);
                if (latest.isPresent() && latest.getAsLong() == version) {
                    continue;
                }
                store.delete(version);
                log.debug("Deleted old checkpoint version={}", version);
            }
        } catch (IOException e) {
            log.warn("Failed to prune old checkpoints in {}: {}", config.getLocation(), e.getMessage());
        }
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
