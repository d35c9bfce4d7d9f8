package com.shopstream.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigTest {

    @Test
    void loadsYamlFromClasspath() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        assertThat(config.getBootstrapServers()).isEqualTo("broker-1:9092,broker-2:9092");
        assertThat(config.getKafka().getConsumerProperties()).containsEntry("security.protocol", "SSL");
        assertThat(config.getSource("products").hasBoundedLateness()).isFalse();
        assertThat(config.getSource("products").getIdleTimeoutMs()).isEqualTo(60_000L);
        assertThat(config.getSource("views").getAllowedLatenessMs()).isEqualTo(30_000L);
        assertThat(config.getMatchWindowMs()).isEqualTo(3_600_000L);
        assertThat(config.getCheckpoint().getIntervalMs()).isEqualTo(10_000);
        assertThat(config.getCheckpoint().getRetainedCheckpoints()).isEqualTo(3);
        assertThat(config.getElasticsearch().getHosts()).containsExactly("http://es-1:9200");
        assertThat(config.getSink().getBatchSize()).isEqualTo(250);
        assertThat(config.getSink().getMaxRetryAttempts()).isEqualTo(5);
        assertThat(config.getEngine().getCapacityPolicy()).isEqualTo(CapacityPolicy.FORCE_FINALIZE_OLDEST);
        config.validate();
    }

    @Test
    void missingResourceIsReported() {
        assertThatThrownBy(() -> PipelineConfig.loadFromClasspath("nope.yaml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("nope.yaml");
    }

    @Test
    void unknownSourceIsRejected() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        assertThatThrownBy(() -> config.getSource("clicks"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validationCatchesUnusableSettings() {
        PipelineConfig empty = new PipelineConfig();
        assertThatThrownBy(empty::validate).hasMessageContaining("At least one source");

        PipelineConfig duplicate = new PipelineConfig();
        duplicate.setSources(List.of(new SourceConfig("views", "a", 1L, null),
                new SourceConfig("views", "b", 1L, null)));
        assertThatThrownBy(duplicate::validate).hasMessageContaining("Duplicate source");

        PipelineConfig negative = new PipelineConfig();
        negative.setSources(List.of(new SourceConfig("views", "a", -5L, null)));
        assertThatThrownBy(negative::validate).hasMessageContaining("Negative allowed lateness");

        PipelineConfig noTopic = new PipelineConfig();
        noTopic.setSources(List.of(new SourceConfig("views", " ", null, null)));
        assertThatThrownBy(noTopic::validate).hasMessageContaining("has no topic");

        PipelineConfig negativeDedup = valid();
        negativeDedup.getJoiner().setDedupHorizonMs(-1L);
        assertThatThrownBy(negativeDedup::validate).hasMessageContaining("joiner.dedupHorizonMs");
    }

    @Test
    void validationCatchesUnusableRetrySettings() {
        valid().validate();

        PipelineConfig noCheckpointAttempts = valid();
        noCheckpointAttempts.getCheckpoint().setMaxWriteAttempts(0);
        assertThatThrownBy(noCheckpointAttempts::validate).hasMessageContaining("checkpoint.maxWriteAttempts");

        PipelineConfig negativeCheckpointBackoff = valid();
        negativeCheckpointBackoff.getCheckpoint().setRetryBackoffMs(-1);
        assertThatThrownBy(negativeCheckpointBackoff::validate).hasMessageContaining("checkpoint.retryBackoffMs");

        PipelineConfig noRetained = valid();
        noRetained.getCheckpoint().setRetainedCheckpoints(0);
        assertThatThrownBy(noRetained::validate).hasMessageContaining("checkpoint.retainedCheckpoints");

        PipelineConfig noSinkAttempts = valid();
        noSinkAttempts.getSink().setMaxRetryAttempts(0);
        assertThatThrownBy(noSinkAttempts::validate).hasMessageContaining("sink.maxRetryAttempts");

        PipelineConfig invertedSinkBackoff = valid();
        invertedSinkBackoff.getSink().setInitialBackoffMs(5_000);
        invertedSinkBackoff.getSink().setMaxBackoffMs(1_000);
        assertThatThrownBy(invertedSinkBackoff::validate).hasMessageContaining("initialBackoffMs <= maxBackoffMs");

        PipelineConfig negativeSinkBackoff = valid();
        negativeSinkBackoff.getSink().setInitialBackoffMs(-1);
        assertThatThrownBy(negativeSinkBackoff::validate).hasMessageContaining("initialBackoffMs");

        PipelineConfig noBatchInterval = valid();
        noBatchInterval.getSink().setBatchIntervalMs(0);
        assertThatThrownBy(noBatchInterval::validate).hasMessageContaining("sink.batchIntervalMs");

        PipelineConfig noStateCapacity = valid();
        noStateCapacity.getEngine().setMaxBufferedFacts(0);
        assertThatThrownBy(noStateCapacity::validate).hasMessageContaining("engine.maxBufferedFacts");

        PipelineConfig invertedSourceBackoff = valid();
        invertedSourceBackoff.getEngine().setSourceRetryMaxBackoffMs(10);
        assertThatThrownBy(invertedSourceBackoff::validate).hasMessageContaining("sourceRetryMaxBackoffMs");
    }

    private static PipelineConfig valid() {
        PipelineConfig config = new PipelineConfig();
        config.setSources(List.of(new SourceConfig("views", "shop.views", 1_000L, null)));
        return config;
    }
}
