package io.groupstream.log.impl;

import io.groupstream.core.model.Event;
import io.groupstream.core.model.SequenceToken;
import io.groupstream.log.type.LogConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.kafka.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
final class KafkaLogConsumerTest {

    @Container
    private static final KafkaContainer KAFKA = new KafkaContainer(DockerImageName.parse("apache/kafka:3.7.1"));

    private static final Duration ATTACH = Duration.ofSeconds(30);

    private static void produce(final String topic, final String... keyValues) throws Exception {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        try (KafkaProducer<String, String> producer = new KafkaProducer<>(props)) {
            for (int i = 0; i < keyValues.length; i += 2) {
                producer.send(new ProducerRecord<>(topic, keyValues[i], keyValues[i + 1])).get();
            }
        }
    }

    private static List<Event> pollUntil(final LogConsumer consumer, final int count) {
        final List<Event> out = new ArrayList<>();
        final long deadline = System.nanoTime() + Duration.ofSeconds(20).toNanos();
        while (out.size() < count && System.nanoTime() < deadline) {
            out.addAll(consumer.poll(Duration.ofMillis(200)));
        }
        return out;
    }

    @Test
    void readsFromEarliestOnFirstAttach() throws Exception {
        produce("asset_stream_Weld_topic",
                "A42", "{\"id\":\"temp\",\"VALUE\":\"1\"}",
                "B17", "{\"id\":\"temp\",\"VALUE\":\"2\"}");

        try (LogConsumer c = new KafkaLogConsumerFactory(KAFKA.getBootstrapServers())
                .open("asset_stream_Weld_topic", "first-run")) {
            c.attach(ATTACH);
            assertTrue(c.isAttached());

            final List<Event> events = pollUntil(c, 2);
            assertEquals(2, events.size());
            assertEquals("A42", events.get(0).entityId());
            assertEquals("temp", events.get(0).itemId());
            assertEquals(0L, SequenceToken.offset(events.get(0).sequenceToken()));
            assertEquals(1L, SequenceToken.offset(events.get(1).sequenceToken()));
        }
    }

    @Test
    void reattachResumesAfterCommittedPosition() throws Exception {
        final String topic = "asset_stream_Paint_topic";
        final KafkaLogConsumerFactory factory = new KafkaLogConsumerFactory(KAFKA.getBootstrapServers());
        produce(topic, "A1", "{}", "A2", "{}");

        try (LogConsumer c = factory.open(topic, "resume")) {
            c.attach(ATTACH);
            assertEquals(2, pollUntil(c, 2).size());
            c.commit();
        }

        produce(topic, "A3", "{}");
        try (LogConsumer c = factory.open(topic, "resume")) {
            c.attach(ATTACH);
            final List<Event> events = pollUntil(c, 1);
            assertEquals(1, events.size());
            assertEquals("A3", events.get(0).entityId());
        }
    }
}
