package com.shopstream.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.checkpoint.CheckpointCodec;
import com.shopstream.checkpoint.CheckpointManager;
import com.shopstream.checkpoint.CheckpointStore;
import com.shopstream.config.PipelineConfig;
import com.shopstream.config.SourceConfig;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.sink.DeadLetterWriter;
import com.shopstream.sink.FileDeadLetterWriter;
import com.shopstream.sink.OutputChannel;
import com.shopstream.sink.SinkDocument;
import com.shopstream.sink.UpsertSink;
import com.shopstream.source.RecordDecoder;
import com.shopstream.source.StreamSourceAdapter;
import com.shopstream.source.StreamSourceFactory;
import com.shopstream.state.KeyedStateStore;
import com.shopstream.watermark.WatermarkCoordinator;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembles an {@link EnrichmentPipeline} from the configuration and a domain
 * {@link JoinTopology}.
 *
 * <p>Every configured source gets its own adapter and worker.  Each source must be known
 * to the topology; the state store, output channel and checkpoint codec are sized and typed
 * from the topology's declarations.</p>
 */
@Slf4j
public class PipelineOrchestrator {

    private final PipelineConfig config;
    private final StreamSourceFactory sourceFactory;
    private final UpsertSink sink;
    private final CheckpointStore checkpointStore;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PipelineOrchestrator(PipelineConfig config, StreamSourceFactory sourceFactory, UpsertSink sink,
                                CheckpointStore checkpointStore, PipelineMetrics metrics,
                                ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.sourceFactory = sourceFactory;
        this.sink = sink;
        this.checkpointStore = checkpointStore;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Builds (but does not start) the pipeline for {@code topology}.
     */
    public <O extends SinkDocument> EnrichmentPipeline<O> build(JoinTopology<O> topology) {
        config.validate();
        List<SourceConfig> sources = config.getSources();
        log.info("Building pipeline with {} sources: {}", sources.size(),
                sources.stream().map(SourceConfig::getName).collect(Collectors.toList()));

        KeyedStateStore store = new KeyedStateStore(topology.dimensionTables(), topology.factBuffers(),
                config.getEngine().getMaxBufferedFacts());
        OutputChannel<O> output = new OutputChannel<>(config.getEngine().getOutputQueueCapacity());
        StreamProcessor processor = topology.createProcessor(store, output::emit, metrics);

        List<StreamSourceAdapter<?>> adapters = new ArrayList<>();
        for (SourceConfig source : sources) {
            adapters.add(adapter(source, topology.decoderFor(source)));
        }
        WatermarkCoordinator watermarks = new WatermarkCoordinator(
                sources.stream().map(SourceConfig::getName).collect(Collectors.toList()),
                config.getEngine().getStallThresholdMs(), clock);

        CheckpointCodec codec = new CheckpointCodec(objectMapper, store.getDimensionDescriptors(),
                store.getFactDescriptors(), topology.outputType());
        CheckpointManager checkpoints = new CheckpointManager(checkpointStore, codec, config.getCheckpoint(),
                metrics, clock);
        DeadLetterWriter deadLetters = new FileDeadLetterWriter(
                Paths.get(config.getSink().getDeadLetterPath()), objectMapper, clock);

        log.info("Pipeline topology built successfully");
        return new EnrichmentPipeline<>(config, adapters, store, processor, watermarks, output,
                topology.outputType(), sink, deadLetters, checkpoints, metrics, clock);
    }

    private <T> StreamSourceAdapter<T> adapter(SourceConfig source, RecordDecoder<T> decoder) {
        return new StreamSourceAdapter<>(source, sourceFactory.createSource(source), decoder, metrics, clock);
    }
}
