package com.shopstream.engine;

import com.shopstream.checkpoint.Checkpoint;
import com.shopstream.checkpoint.CheckpointManager;
import com.shopstream.checkpoint.CheckpointWriteFailedException;
import com.shopstream.config.PipelineConfig;
import com.shopstream.metrics.MetricsSnapshot;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.sink.DeadLetterWriter;
import com.shopstream.sink.OutputChannel;
import com.shopstream.sink.SinkDocument;
import com.shopstream.sink.UpsertSink;
import com.shopstream.sink.UpsertSinkWriter;
import com.shopstream.source.SourceBatch;
import com.shopstream.source.SourceWorker;
import com.shopstream.source.StreamSourceAdapter;
import com.shopstream.state.KeyedStateStore;
import com.shopstream.watermark.WatermarkCoordinator;
import com.shopstream.watermark.WatermarkHealth;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A running enrichment pipeline and its threads.
 *
 * <pre>
 *   source workers (1 per source) ──► ingestion queue ──► evaluation loop ──► output channel ──► sink writer
 *                                                              │
 *                                                              └── checkpoint capture ──► checkpoint executor
 * </pre>
 *
 * <p>{@link #stop()} shuts down in dependency order (workers, evaluation loop, sink
 * writer, final checkpoint) within the configured grace period.  Whatever does not
 * complete in time is abandoned and recovered from the last checkpoint on restart.</p>
 *
 * <p>A fatal failure in any thread stops the whole pipeline and is reported by
 * {@link #getFailure()}.</p>
 */
@Slf4j
public class EnrichmentPipeline<O extends SinkDocument> {

    private final PipelineConfig config;
    private final List<StreamSourceAdapter<?>> adapters;
    private final KeyedStateStore store;
    private final StreamProcessor processor;
    private final WatermarkCoordinator watermarks;
    private final OutputChannel<O> output;
    private final Class<O> outputType;
    private final UpsertSink sink;
    private final DeadLetterWriter deadLetters;
    private final CheckpointManager checkpoints;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final ShutdownSignal shutdown = new ShutdownSignal();
    private final BlockingQueue<SourceBatch> ingestion;
    private final EvaluationLoop loop;
    private final UpsertSinkWriter<O> sinkWriter;
    private final List<SourceWorker> workers = new ArrayList<>();
    private final List<Thread> workerThreads = new ArrayList<>();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService checkpointExecutor;

    private Thread loopThread;
    private Thread sinkThread;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean stateConsistent = true;

    public EnrichmentPipeline(PipelineConfig config, List<StreamSourceAdapter<?>> adapters, KeyedStateStore store,
                              StreamProcessor processor, WatermarkCoordinator watermarks, OutputChannel<O> output,
                              Class<O> outputType, UpsertSink sink, DeadLetterWriter deadLetters,
                              CheckpointManager checkpoints, PipelineMetrics metrics, Clock clock) {
        this.config = config;
        this.adapters = adapters;
        this.store = store;
        this.processor = processor;
        this.watermarks = watermarks;
        this.output = output;
        this.outputType = outputType;
        this.sink = sink;
        this.deadLetters = deadLetters;
        this.checkpoints = checkpoints;
        this.metrics = metrics;
        this.clock = clock;

        this.ingestion = new ArrayBlockingQueue<>(config.getEngine().getIngestionQueueCapacity());
        this.loop = new EvaluationLoop(ingestion, processor, store, watermarks, output, metrics, clock,
                this::persistAsync);
        this.sinkWriter = new UpsertSinkWriter<>(output, sink, deadLetters, config.getSink(), metrics, shutdown);
        this.scheduler = Executors.newScheduledThreadPool(1, r -> daemon(r, "shopstream-scheduler"));
        this.checkpointExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "shopstream-checkpoint"));
    }

    /**
     * Restores the latest checkpoint, if any, and starts every thread.
     */
    public void start() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already started");
        }
        Optional<Checkpoint> restored = checkpoints.restore();
        Map<String, Long> sourceWatermarks = Map.of();
        if (restored.isPresent()) {
            Checkpoint checkpoint = restored.get();
            store.restore(checkpoint.getState());
            watermarks.restore(checkpoint.getSourceWatermarks(), checkpoint.getGlobalWatermark());
            loop.restoreOffsets(checkpoint.getOffsets());
            processor.onRestore();
            sourceWatermarks = checkpoint.getSourceWatermarks();
        }

        sinkThread = newThread("shopstream-sink", sinkWriter);
        sinkThread.start();
        if (restored.isPresent()) {
            List<O> pending = new ArrayList<>();
            for (Object record : restored.get().getPendingOutputs()) {
                pending.add(outputType.cast(record));
            }
            output.requeue(pending);
        }

        Duration pollTimeout = Duration.ofMillis(config.getKafka().getPollTimeoutMs());
        ExponentialBackoff sourceBackoff = new ExponentialBackoff(
                config.getEngine().getSourceRetryInitialBackoffMs(), config.getEngine().getSourceRetryMaxBackoffMs());
        for (StreamSourceAdapter<?> adapter : adapters) {
            adapter.start(loop.offsetsOf(adapter.getName()),
                    sourceWatermarks.getOrDefault(adapter.getName(), Long.MIN_VALUE));
            SourceWorker worker = new SourceWorker(adapter, ingestion, pollTimeout, sourceBackoff, shutdown);
            workers.add(worker);
            workerThreads.add(newThread("shopstream-source-" + adapter.getName(), worker));
        }

        loopThread = newThread("shopstream-evaluation", loop);
        loopThread.start();
        workerThreads.forEach(Thread::start);

        long interval = config.getCheckpoint().getIntervalMs();
        scheduler.scheduleAtFixedRate(loop::requestCheckpoint, interval, interval, TimeUnit.MILLISECONDS);
        long healthInterval = config.getEngine().getHealthLogIntervalMs();
        scheduler.scheduleAtFixedRate(this::logHealth, healthInterval, healthInterval, TimeUnit.MILLISECONDS);

        log.info("Pipeline started with {} sources, checkpoint every {} ms", adapters.size(), interval);
    }

    /**
     * Graceful shutdown.  Idempotent; a second caller waits for the first to finish.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            awaitQuietly();
            return;
        }
        if (!started.get()) {
            terminated.countDown();
            return;
        }
        long deadline = clock.millis() + config.getEngine().getShutdownGracePeriodMs();
        log.info("Stopping pipeline (grace period {} ms)", config.getEngine().getShutdownGracePeriodMs());
        shutdown.trigger();
        scheduler.shutdownNow();
        try {
            workers.forEach(SourceWorker::stop);
            for (Thread thread : workerThreads) {
                if (!joinUntil(thread, deadline)) {
                    log.warn("Source worker {} did not stop in time", thread.getName());
                    thread.interrupt();
                }
            }

            loop.finish();
            if (!joinUntil(loopThread, deadline)) {
                log.warn("Evaluation loop did not drain in time, abandoning {} queued batches", ingestion.size());
                loop.stop();
                loopThread.interrupt();
                joinUntil(loopThread, clock.millis() + 1_000);
                stateConsistent = false;
            }

            sinkWriter.finish();
            if (!joinUntil(sinkThread, deadline)) {
                log.warn("Sink writer did not flush in time, {} outputs left to the checkpoint",
                        output.unackedCount());
                sinkThread.interrupt();
            }

            writeFinalCheckpoint(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping the pipeline");
        } finally {
            checkpointExecutor.shutdownNow();
            adapters.forEach(StreamSourceAdapter::close);
            sink.close();
            deadLetters.close();
            log.info("Pipeline stopped: {}", metrics.snapshot(watermarks.health()));
            terminated.countDown();
        }
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    /**
     * The fatal error that stopped the pipeline, or {@code null}.
     */
    public Throwable getFailure() {
        return failure.get();
    }

    public MetricsSnapshot health() {
        return metrics.snapshot(watermarks.health());
    }

    /**
     * Asks for a checkpoint at the next batch boundary.
     */
    public void triggerCheckpoint() {
        loop.requestCheckpoint();
    }

    private void persistAsync(Checkpoint checkpoint) {
        try {
            checkpointExecutor.execute(() -> persist(checkpoint));
        } catch (RejectedExecutionException e) {
            log.debug("Checkpoint executor shut down, dropping periodic checkpoint");
        }
    }

    private void persist(Checkpoint checkpoint) {
        try {
            checkpoints.persist(checkpoint);
        } catch (CheckpointWriteFailedException e) {
            log.error("Checkpoint failed, version={} stays authoritative", checkpoints.getLastVersion() - 1, e);
        }
    }

    private void writeFinalCheckpoint(long deadline) throws InterruptedException {
        if (!stateConsistent || loopThread.isAlive()) {
            log.warn("Skipping final checkpoint: keyed state may be half-applied; restart resumes from version={}",
                    checkpoints.getLastVersion());
            return;
        }
        // The loop has exited, so capturing from this thread is safe.
        Checkpoint checkpoint = loop.captureCheckpoint();
        checkpointExecutor.execute(() -> persist(checkpoint));
        checkpointExecutor.shutdown();
        long remaining = Math.max(deadline - clock.millis(), 1_000);
        if (!checkpointExecutor.awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
            log.warn("Final checkpoint did not complete within the grace period");
        }
    }

    private void logHealth() {
        WatermarkHealth health = watermarks.health();
        log.info("Pipeline health: {}", metrics.snapshot(health));
        if (!health.isHealthy()) {
            log.warn("Sources {} show no progress; global watermark held at {}",
                    health.getStalledSources(), health.getGlobalWatermark());
        }
    }

    private Thread newThread(String name, Runnable task) {
        return new Thread(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                onFatal(name, e);
            }
        }, name);
    }

    private void onFatal(String component, RuntimeException e) {
        if (Thread.currentThread() == loopThread) {
            stateConsistent = false;
        }
        if (failure.compareAndSet(null, e)) {
            log.error("Fatal failure in {}, stopping pipeline", component, e);
        } else {
            log.error("Further failure in {} while stopping", component, e);
        }
        Thread stopper = new Thread(this::stop, "shopstream-stop");
        stopper.start();
    }

    private void awaitQuietly() {
        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean joinUntil(Thread thread, long deadline) throws InterruptedException {
        long remaining = deadline - clock.millis();
        if (remaining > 0) {
            thread.join(remaining);
        }
        return !thread.isAlive();
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
