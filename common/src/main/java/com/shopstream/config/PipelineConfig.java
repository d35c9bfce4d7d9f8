package com.shopstream.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code shopstream.*} prefix.  The static
 * {@link #load(String)} and {@link #loadFromClasspath(String)} helpers are kept for
 * standalone / test usage outside the Spring context.</p>
 */
@Data
@ConfigurationProperties(prefix = "shopstream")
public class PipelineConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private KafkaSection kafka = new KafkaSection();
    private List<SourceConfig> sources = new ArrayList<>();
    private JoinerSection joiner = new JoinerSection();
    private CheckpointConfig checkpoint = new CheckpointConfig();
    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private SinkConfig sink = new SinkConfig();
    private EngineConfig engine = new EngineConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), PipelineConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public String getBootstrapServers() {
        return kafka.getBootstrapServers();
    }

    /**
     * Returns the configuration of the named source.
     *
     * @throws IllegalArgumentException if no source with that name is configured
     */
    public SourceConfig getSource(String name) {
        return sources.stream()
                .filter(s -> name.equals(s.getName()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + name));
    }

    /**
     * Match window in milliseconds, or {@code null} when any earlier sale is eligible.
     */
    public Long getMatchWindowMs() {
        return joiner.getMatchWindowMs();
    }

    /**
     * How long past a view's deadline re-deliveries are dropped, or {@code null} for ever.
     */
    public Long getDedupHorizonMs() {
        return joiner.getDedupHorizonMs();
    }

    /**
     * Fails fast on settings that would leave the pipeline unable to make progress.
     */
    public void validate() {
        if (sources.isEmpty()) {
            throw new IllegalStateException("At least one source must be configured");
        }
        Set<String> names = new HashSet<>();
        for (SourceConfig source : sources) {
            if (source.getName() == null || source.getName().isBlank()) {
                throw new IllegalStateException("Source without a name: " + source);
            }
            if (source.getTopic() == null || source.getTopic().isBlank()) {
                throw new IllegalStateException("Source '" + source.getName() + "' has no topic");
            }
            if (!names.add(source.getName())) {
                throw new IllegalStateException("Duplicate source name: " + source.getName());
            }
            if (source.getAllowedLatenessMs() != null && source.getAllowedLatenessMs() < 0) {
                throw new IllegalStateException("Negative allowed lateness for source " + source.getName());
            }
        }
        if (joiner.getMatchWindowMs() != null && joiner.getMatchWindowMs() < 0) {
            throw new IllegalStateException("joiner.matchWindowMs must not be negative");
        }
        if (joiner.getDedupHorizonMs() != null && joiner.getDedupHorizonMs() < 0) {
            throw new IllegalStateException("joiner.dedupHorizonMs must not be negative");
        }
        if (sink.getBatchSize() <= 0) {
            throw new IllegalStateException("sink.batchSize must be positive");
        }
        if (sink.getBatchIntervalMs() <= 0) {
            throw new IllegalStateException("sink.batchIntervalMs must be positive");
        }
        if (sink.getMaxRetryAttempts() <= 0) {
            throw new IllegalStateException("sink.maxRetryAttempts must be positive");
        }
        if (sink.getInitialBackoffMs() < 0 || sink.getMaxBackoffMs() < sink.getInitialBackoffMs()) {
            throw new IllegalStateException("sink backoff must satisfy 0 <= initialBackoffMs <= maxBackoffMs, got "
                    + sink.getInitialBackoffMs() + " and " + sink.getMaxBackoffMs());
        }
        if (sink.getDeadLetterCapacity() < 0) {
            throw new IllegalStateException("sink.deadLetterCapacity must not be negative");
        }
        if (checkpoint.getIntervalMs() <= 0) {
            throw new IllegalStateException("checkpoint.intervalMs must be positive");
        }
        if (checkpoint.getRetainedCheckpoints() <= 0) {
            throw new IllegalStateException("checkpoint.retainedCheckpoints must be positive");
        }
        if (checkpoint.getMaxWriteAttempts() <= 0) {
            throw new IllegalStateException("checkpoint.maxWriteAttempts must be positive");
        }
        if (checkpoint.getRetryBackoffMs() < 0) {
            throw new IllegalStateException("checkpoint.retryBackoffMs must not be negative");
        }
        if (engine.getMaxBufferedFacts() <= 0) {
            throw new IllegalStateException("engine.maxBufferedFacts must be positive");
        }
        if (engine.getIngestionQueueCapacity() <= 0 || engine.getOutputQueueCapacity() <= 0) {
            throw new IllegalStateException("engine queue capacities must be positive");
        }
        if (engine.getSourceRetryInitialBackoffMs() < 0
                || engine.getSourceRetryMaxBackoffMs() < engine.getSourceRetryInitialBackoffMs()) {
            throw new IllegalStateException("engine source retry backoff must satisfy "
                    + "0 <= sourceRetryInitialBackoffMs <= sourceRetryMaxBackoffMs");
        }
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class KafkaSection {
        private String bootstrapServers;
        private String clientId = "shopstream";
        private long pollTimeoutMs = 500;
        /** Passed through verbatim to every consumer (security settings, fetch tuning, ...). */
        private Map<String, String> consumerProperties = new HashMap<>();
    }

    @Data
    public static class JoinerSection {
        /**
         * Upper bound on how far a sale's event time may lie after the view's event time.
         * {@code null} means unbounded: any sale recorded for the product is eligible.
         */
        private Long matchWindowMs;
        /**
         * How long past a view's deadline a re-delivery of that view is still recognised and
         * dropped.  {@code null} means for as long as the job runs.
         */
        private Long dedupHorizonMs = 3_600_000L;
    }
}
