package com.shopstream.pageviews;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.checkpoint.FileSystemCheckpointStore;
import com.shopstream.config.PipelineConfig;
import com.shopstream.config.SourceConfig;
import com.shopstream.engine.EnrichmentPipeline;
import com.shopstream.engine.PipelineOrchestrator;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.pageviews.join.PageViewTopology;
import com.shopstream.pageviews.model.EnrichedRecord;
import com.shopstream.pageviews.model.ProductRecord;
import com.shopstream.pageviews.model.SaleEvent;
import com.shopstream.pageviews.model.UserRecord;
import com.shopstream.pageviews.model.ViewEvent;
import com.shopstream.serde.ObjectMapperFactory;
import com.shopstream.sink.SinkDocument;
import com.shopstream.sink.UpsertResult;
import com.shopstream.sink.UpsertSink;
import com.shopstream.source.PartitionedStreamSource;
import com.shopstream.source.RawRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the whole pipeline over in-memory logs, stops it, and resumes from its checkpoint.
 */
class PageViewPipelineTest {

    /** Single-partition log that can be appended to while it is read. */
    static class InMemoryLog implements PartitionedStreamSource {
        private final String topic;
        private final List<RawRecord> records = new ArrayList<>();
        private int position;

        InMemoryLog(String topic) {
            this.topic = topic;
        }

        synchronized void append(byte[] value) {
            records.add(new RawRecord(0, records.size(), 0, value));
        }

        @Override
        public String getTopic() {
            return topic;
        }

        @Override
        public synchronized void seek(Map<Integer, Long> startOffsets) {
            position = startOffsets.getOrDefault(0, 0L).intValue();
        }

        @Override
        public List<RawRecord> poll(Duration timeout) {
            synchronized (this) {
                if (position < records.size()) {
                    List<RawRecord> batch = new ArrayList<>(records.subList(position, records.size()));
                    position = records.size();
                    return batch;
                }
            }
            try {
                Thread.sleep(Math.min(timeout.toMillis(), 10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        }

        @Override
        public synchronized boolean isCaughtUp() {
            return position >= records.size();
        }

        @Override
        public void wakeup() {
        }

        @Override
        public void close() {
        }
    }

    static class InMemorySink implements UpsertSink {
        final Map<String, EnrichedRecord> index = new ConcurrentHashMap<>();

        @Override
        public List<UpsertResult> upsert(List<? extends SinkDocument> documents) {
            List<UpsertResult> results = new ArrayList<>();
            for (SinkDocument document : documents) {
                index.put(document.getDocumentId(), (EnrichedRecord) document);
                results.add(UpsertResult.ok(document.getDocumentId()));
            }
            return results;
        }

        @Override
        public void close() {
        }
    }

    @TempDir
    Path dir;

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final Map<String, InMemoryLog> logs = new ConcurrentHashMap<>();
    private final InMemorySink sink = new InMemorySink();
    private PipelineConfig config;
    private FileSystemCheckpointStore checkpoints;
    private EnrichmentPipeline<EnrichedRecord> pipeline;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        config.setSources(List.of(
                new SourceConfig("products", "shop.products", null, 50L),
                new SourceConfig("users", "shop.users", null, 50L),
                new SourceConfig("sales", "shop.sales", 1_000L, null),
                new SourceConfig("views", "shop.views", 1_000L, null)));
        config.getKafka().setPollTimeoutMs(20);
        config.getSink().setBatchIntervalMs(20);
        config.getSink().setDeadLetterPath(dir.resolve("dead-letter.jsonl").toString());
        config.getCheckpoint().setIntervalMs(60_000);
        config.getEngine().setShutdownGracePeriodMs(5_000);
        for (SourceConfig source : config.getSources()) {
            logs.put(source.getName(), new InMemoryLog(source.getTopic()));
        }
        checkpoints = new FileSystemCheckpointStore(dir.resolve("checkpoints"));
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.stop();
        }
    }

    private EnrichmentPipeline<EnrichedRecord> startPipeline() throws InterruptedException {
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(config, source -> logs.get(source.getName()),
                sink, checkpoints, new PipelineMetrics(), mapper, Clock.systemUTC());
        EnrichmentPipeline<EnrichedRecord> started = orchestrator.build(new PageViewTopology(config, mapper));
        started.start();
        return started;
    }

    private void append(String source, Object value) throws JsonProcessingException {
        logs.get(source).append(mapper.writeValueAsBytes(value));
    }

    private static ViewEvent view(String productId, String userId, long viewTime, long eventTime) {
        return ViewEvent.builder().productId(productId).userId(userId).viewTime(viewTime).eventTime(eventTime)
                .pageUrl("/products/" + productId).build();
    }

    private static SaleEvent sale(long orderId, String productId, long eventTime) {
        return SaleEvent.builder().orderId(orderId).productId(productId).customerId("c").eventTime(eventTime).build();
    }

    private void awaitDocuments(String... ids) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!sink.index.keySet().containsAll(List.of(ids)) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(sink.index).containsKeys(ids);
    }

    @Test
    void enrichesViewsAndResumesPendingOnesAfterRestart() throws Exception {
        append("products", ProductRecord.builder().id("P1").name("Kettle").brand("Acme").build());
        append("products", ProductRecord.builder().id("P2").name("Toaster").brand("Acme").build());
        append("users", UserRecord.builder().id("U1").firstName("Ada").lastName("Lovelace").build());
        append("users", UserRecord.builder().id("U2").firstName("Grace").lastName("Hopper").build());
        append("sales", sale(1000, "P1", 9_995));
        append("sales", sale(2000, "P2", 20_000));
        append("sales", sale(9000, "P9", 100_000));
        append("views", view("P1", "U1", 78, 10_000));
        append("views", view("P2", "U2", 21_000, 21_000));
        append("views", view("P3", "U1", 30_000, 30_000));
        append("views", view("P9", "U9", 100_000, 100_000));
        logs.get("views").append("{not json".getBytes());

        pipeline = startPipeline();
        awaitDocuments("P1:U1:78", "P2:U2:21000", "P3:U1:30000");

        EnrichedRecord first = sink.index.get("P1:U1:78");
        assertThat(first.getOrderId()).isEqualTo(1000L);
        assertThat(first.getOrderDate()).isEqualTo(9_995L);
        assertThat(first.getProductName()).isEqualTo("Kettle");
        assertThat(first.getFirstName()).isEqualTo("Ada");
        assertThat(sink.index.get("P2:U2:21000").getOrderId()).isEqualTo(2000L);
        EnrichedRecord unmatched = sink.index.get("P3:U1:30000");
        assertThat(unmatched.getProductName()).isNull();
        assertThat(unmatched.getOrderId()).isNull();
        assertThat(unmatched.getFirstName()).isEqualTo("Ada");
        assertThat(pipeline.health().getCorruptRecords()).isEqualTo(1);
        assertThat(sink.index).doesNotContainKey("P9:U9:100000");

        pipeline.stop();
        assertThat(pipeline.getFailure()).isNull();
        assertThat(checkpoints.latestVersion()).isPresent();

        append("sales", sale(9001, "P5", 200_000));
        append("views", view("P1", "U2", 200_000, 200_000));
        pipeline = startPipeline();

        awaitDocuments("P9:U9:100000", "P1:U2:200000");
        assertThat(sink.index.get("P9:U9:100000").getOrderId()).isEqualTo(9000L);
        assertThat(sink.index.get("P1:U2:200000").getOrderId()).isEqualTo(1000L);
        assertThat(sink.index.get("P1:U2:200000").getFirstName()).isEqualTo("Grace");
    }
}
