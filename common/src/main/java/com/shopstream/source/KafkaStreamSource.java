package com.shopstream.source;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * {@link PartitionedStreamSource} over one Kafka topic.
 *
 * <p>The consumer is assigned every partition of the topic manually: there is no consumer
 * group and no offset commit, because read positions are owned by the pipeline checkpoint.
 * Assignment is lazy, so a topic that does not exist yet surfaces as
 * {@link SourceUnavailableException} on poll and is retried by the worker.</p>
 */
@Slf4j
public class KafkaStreamSource implements PartitionedStreamSource {

    private final Consumer<byte[], byte[]> consumer;
    private final String topic;

    private Map<Integer, Long> startOffsets = Collections.emptyMap();
    private List<TopicPartition> assigned;

    public KafkaStreamSource(Consumer<byte[], byte[]> consumer, String topic) {
        this.consumer = consumer;
        this.topic = topic;
    }

    @Override
    public String getTopic() {
        return topic;
    }

    @Override
    public void seek(Map<Integer, Long> startOffsets) {
        this.startOffsets = new HashMap<>(startOffsets);
        this.assigned = null;
    }

    @Override
    public List<RawRecord> poll(Duration timeout) {
        try {
            ensureAssigned();
            ConsumerRecords<byte[], byte[]> records = consumer.poll(timeout);
            List<RawRecord> result = new ArrayList<>(records.count());
            for (ConsumerRecord<byte[], byte[]> record : records) {
                result.add(new RawRecord(record.partition(), record.offset(),
                        record.timestamp(), record.value()));
            }
            return result;
        } catch (WakeupException e) {
            log.debug("Poll on topic={} woken up", topic);
            return Collections.emptyList();
        } catch (KafkaException e) {
            throw new SourceUnavailableException("Failed to read topic " + topic + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isCaughtUp() {
        if (assigned == null) {
            return false;
        }
        try {
            for (TopicPartition tp : assigned) {
                OptionalLong lag = consumer.currentLag(tp);
                if (lag.isEmpty() || lag.getAsLong() > 0) {
                    return false;
                }
            }
            return true;
        } catch (KafkaException e) {
            log.debug("Lag of topic={} unavailable: {}", topic, e.getMessage());
            return false;
        }
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        consumer.close();
    }

    private void ensureAssigned() {
        if (assigned != null) {
            return;
        }
        List<PartitionInfo> partitions = consumer.partitionsFor(topic);
        if (partitions == null || partitions.isEmpty()) {
            throw new SourceUnavailableException("Topic " + topic + " has no partitions (yet)");
        }
        List<TopicPartition> tps = new ArrayList<>();
        for (PartitionInfo info : partitions) {
            tps.add(new TopicPartition(topic, info.partition()));
        }
        consumer.assign(tps);

        List<TopicPartition> fromBeginning = new ArrayList<>();
        for (TopicPartition tp : tps) {
            Long offset = startOffsets.get(tp.partition());
            if (offset != null) {
                consumer.seek(tp, offset);
            } else {
                fromBeginning.add(tp);
            }
        }
        if (!fromBeginning.isEmpty()) {
            consumer.seekToBeginning(fromBeginning);
        }
        assigned = tps;
        log.info("Assigned topic={} partitions={} resumed={} fromBeginning={}",
                topic, tps.size(), tps.size() - fromBeginning.size(), fromBeginning.size());
    }
}
