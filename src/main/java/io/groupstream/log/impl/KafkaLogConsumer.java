package io.groupstream.log.impl;

import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.core.model.Event;
import io.groupstream.core.model.SequenceToken;
import io.groupstream.log.type.LogConsumer;
import io.groupstream.transport.codec.EventCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Derived-log reader over a Kafka consumer group. Offsets are committed
 * explicitly after fan-out, so a reconnect resumes at the last committed position.
 */
@Slf4j
public final class KafkaLogConsumer implements LogConsumer {
    private static final Duration ATTACH_POLL = Duration.ofMillis(100);

    private final String topic;
    private final KafkaConsumer<String, String> consumer;
    private final Map<TopicPartition, OffsetAndMetadata> uncommitted = new HashMap<>();
    /* Records returned by polls issued while waiting for assignment. */
    private final List<Event> early = new ArrayList<>();

    private boolean attached;

    public KafkaLogConsumer(final String bootstrapServers,
                            final String topic,
                            final String consumerGroupId) {
        this.topic = topic;

        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

        try {
            this.consumer = new KafkaConsumer<>(props);
        } catch (final KafkaException e) {
            throw new ServiceUnavailableException("Cannot create consumer for " + topic, e);
        }
    }

    @Override
    public void attach(final Duration timeout) {
        try {
            consumer.subscribe(List.of(topic));
            log.info("Subscribed to {}, waiting for partition assignment...", topic);

            final long deadline = System.nanoTime() + timeout.toNanos();
            while (System.nanoTime() < deadline) {
                early.addAll(convert(consumer.poll(ATTACH_POLL)));
                if (!consumer.assignment().isEmpty()) {
                    attached = true;
                    log.info("Assigned partitions for {}: {}", topic, consumer.assignment());
                    return;
                }
            }
        } catch (final KafkaException e) {
            throw new ServiceUnavailableException("Kafka unavailable while attaching to " + topic, e);
        }
        throw new ServiceUnavailableException("No partition assignment for " + topic + " within " + timeout);
    }

    @Override
    public boolean isAttached() {
        return attached && !consumer.assignment().isEmpty();
    }

    @Override
    public List<Event> poll(final Duration timeout) {
        if (!early.isEmpty()) {
            final List<Event> out = new ArrayList<>(early);
            early.clear();
            return out;
        }
        try {
            return convert(consumer.poll(timeout));
        } catch (final KafkaException e) {
            throw new ServiceUnavailableException("Kafka poll failed on " + topic, e);
        }
    }

    @Override
    public void commit() {
        if (uncommitted.isEmpty()) return;
        try {
            consumer.commitSync(uncommitted);
            uncommitted.clear();
        } catch (final KafkaException e) {
            throw new ServiceUnavailableException("Kafka commit failed on " + topic, e);
        }
    }

    private List<Event> convert(final ConsumerRecords<String, String> records) {
        if (records.isEmpty()) return List.of();

        final List<Event> out = new ArrayList<>(records.count());
        for (final ConsumerRecord<String, String> r : records) {
            uncommitted.put(new TopicPartition(r.topic(), r.partition()), new OffsetAndMetadata(r.offset() + 1));
            final Event e = EventCodec.fromLogRecord(
                    r.key(), r.value(), r.timestamp(), SequenceToken.encode(r.partition(), r.offset()));
            if (e == null) {
                log.debug("Skipping record without entity at {}-{}@{}", r.topic(), r.partition(), r.offset());
                continue;
            }
            out.add(e);
        }
        return out;
    }

    @Override
    public void close() {
        attached = false;
        try {
            consumer.close(Duration.ofSeconds(5));
        } catch (final KafkaException e) {
            log.warn("Error closing consumer for {}: {}", topic, e.getMessage());
        }
    }
}
