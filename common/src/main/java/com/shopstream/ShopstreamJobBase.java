package com.shopstream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.checkpoint.FileSystemCheckpointStore;
import com.shopstream.config.PipelineConfig;
import com.shopstream.engine.EnrichmentPipeline;
import com.shopstream.engine.JoinTopology;
import com.shopstream.engine.PipelineOrchestrator;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.serde.ObjectMapperFactory;
import com.shopstream.sink.ElasticsearchUpsertSink;
import com.shopstream.sink.SinkDocument;
import com.shopstream.source.KafkaSourceFactory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Abstract base for domain-specific enrichment jobs.
 *
 * <p>Subclasses provide the default config resource, a display name and their
 * {@link JoinTopology}.  Sources, checkpoints and the sink are wired from the YAML
 * configuration without a Spring context; applications that embed the pipeline in one
 * import {@link com.shopstream.config.ShopstreamPipelineAutoConfiguration} instead.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class PageViewsJob extends ShopstreamJobBase&lt;EnrichedRecord&gt; {
 *       protected String getDefaultConfigResource() { return "application.yaml"; }
 *       protected String getJobName(PipelineConfig c) { return "Page Views"; }
 *       protected JoinTopology&lt;EnrichedRecord&gt; createTopology(PipelineConfig c, ObjectMapper m) { ... }
 *       public static void main(String[] args) throws Exception { System.exit(new PageViewsJob().run(args)); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class ShopstreamJobBase<O extends SinkDocument> {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    protected abstract String getJobName(PipelineConfig config);

    protected abstract JoinTopology<O> createTopology(PipelineConfig config, ObjectMapper objectMapper);

    /**
     * Runs the pipeline until it is stopped by a signal or fails.
     *
     * @param args optional single argument: path to a YAML config file
     * @return process exit code: 0 after a clean stop, 1 after a fatal failure
     */
    public int run(String[] args) throws Exception {
        // ── Load configuration ───────────────────────────────────────────
        PipelineConfig config;
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            config = PipelineConfig.load(args[0]);
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = PipelineConfig.loadFromClasspath(resource);
        }
        log.info("Sources configured: {}", config.getSources().size());

        // ── Build and run pipeline ───────────────────────────────────────
        ObjectMapper objectMapper = ObjectMapperFactory.create();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(config,
                new KafkaSourceFactory(config),
                new ElasticsearchUpsertSink(config.getElasticsearch(), objectMapper),
                new FileSystemCheckpointStore(Paths.get(config.getCheckpoint().getLocation())),
                new PipelineMetrics(), objectMapper, Clock.systemUTC());
        EnrichmentPipeline<O> pipeline = orchestrator.build(createTopology(config, objectMapper));

        Runtime.getRuntime().addShutdownHook(new Thread(pipeline::stop, "shopstream-shutdown-hook"));
        log.info("Starting {}", getJobName(config));
        pipeline.start();
        pipeline.awaitTermination();

        Throwable failure = pipeline.getFailure();
        if (failure != null) {
            log.error("{} terminated after a fatal failure: {}", getJobName(config), failure.getMessage());
            return 1;
        }
        log.info("{} stopped", getJobName(config));
        return 0;
    }
}
