package com.shopstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.checkpoint.CheckpointStore;
import com.shopstream.checkpoint.FileSystemCheckpointStore;
import com.shopstream.engine.PipelineOrchestrator;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.serde.ObjectMapperFactory;
import com.shopstream.sink.ElasticsearchUpsertSink;
import com.shopstream.sink.UpsertSink;
import com.shopstream.source.KafkaSourceFactory;
import com.shopstream.source.StreamSourceFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Spring configuration that wires the pipeline beans, for applications that host the
 * pipeline inside their own Spring context and {@code @Import} this class.
 *
 * <p>The standalone jobs do not start a Spring context: {@link com.shopstream.ShopstreamJobBase}
 * builds the same collaborators directly from the YAML configuration.  Transport-facing
 * beans back off when the hosting application defines its own, which is how tests swap in
 * fakes.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class ShopstreamPipelineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "shopstreamObjectMapper")
    public ObjectMapper shopstreamObjectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineMetrics pipelineMetrics() {
        return new PipelineMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock shopstreamClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamSourceFactory streamSourceFactory(PipelineConfig config) {
        return new KafkaSourceFactory(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointStore checkpointStore(PipelineConfig config) {
        return new FileSystemCheckpointStore(Paths.get(config.getCheckpoint().getLocation()));
    }

    @Bean
    @ConditionalOnMissingBean
    public UpsertSink upsertSink(PipelineConfig config,
                                 @Qualifier("shopstreamObjectMapper") ObjectMapper objectMapper) {
        return new ElasticsearchUpsertSink(config.getElasticsearch(), objectMapper);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineConfig config,
                                                     StreamSourceFactory streamSourceFactory,
                                                     UpsertSink upsertSink,
                                                     CheckpointStore checkpointStore,
                                                     PipelineMetrics pipelineMetrics,
                                                     @Qualifier("shopstreamObjectMapper") ObjectMapper objectMapper,
                                                     Clock shopstreamClock) {
        return new PipelineOrchestrator(config, streamSourceFactory, upsertSink, checkpointStore,
                pipelineMetrics, objectMapper, shopstreamClock);
    }
}
