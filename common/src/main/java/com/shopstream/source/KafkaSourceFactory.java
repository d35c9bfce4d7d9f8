package com.shopstream.source;

import com.shopstream.config.PipelineConfig;
import com.shopstream.config.SourceConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

import java.util.Properties;

/**
 * Factory that creates {@link KafkaStreamSource} instances from pipeline configuration.
 * Centralises Kafka consumer setup so that the pipeline wiring stays clean.
 */
public class KafkaSourceFactory implements StreamSourceFactory {

    private final PipelineConfig.KafkaSection kafka;

    public KafkaSourceFactory(PipelineConfig config) {
        this.kafka = config.getKafka();
    }

    /**
     * Creates an unassigned source for the given input stream.
     */
    @Override
    public PartitionedStreamSource createSource(SourceConfig source) {
        return new KafkaStreamSource(new KafkaConsumer<>(consumerProperties(source)), source.getTopic());
    }

    Properties consumerProperties(SourceConfig source) {
        Properties props = new Properties();
        props.putAll(kafka.getConsumerProperties());
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, kafka.getClientId() + "-" + source.getName());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return props;
    }
}
