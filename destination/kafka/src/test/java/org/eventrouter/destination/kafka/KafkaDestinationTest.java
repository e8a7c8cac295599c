package org.eventrouter.destination.kafka;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.api.EventOrigin;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.ObjectIdentity;
import org.eventrouter.api.SubjectReference;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Kafka destination")
@DisplayNameGeneration(ReplaceUnderscores.class)
class KafkaDestinationTest {

    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();

    @Test
    void publishes_envelope_json_keyed_by_involved_object() {
        // Given
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDestination destination = new KafkaDestination(producer, "events", codec);
        EventEnvelope envelope = EventEnvelope.added(eventRecord("1"));

        // When
        destination.deliver(envelope);

        // Then
        List<ProducerRecord<String, String>> history = producer.history();
        assertAll(
                () -> assertThat(history).hasSize(1),
                () -> assertThat(history.get(0).topic()).isEqualTo("events"),
                () -> assertThat(history.get(0).key()).isEqualTo("default/pod-a"),
                () -> assertThat(codec.fromJson(history.get(0).value())).isEqualTo(envelope)
        );
    }

    @Test
    void missing_namespace_or_name_is_rendered_as_empty_in_the_key() {
        // Given
        EventRecord clusterScoped = new EventRecord(new ObjectIdentity("node-1.17b", null, "1"), "Normal", "Rebooted", "Node rebooted", 1,
                new SubjectReference("Node", "node-1", null, "v1", "uid-2"), null, null, null);
        EventRecord unnamed = new EventRecord(new ObjectIdentity("x.17b", "default", "2"), "Normal", "Pulled", "Image pulled", 1,
                new SubjectReference("Pod", null, "default", "v1", "uid-3"), null, null, null);

        // When / Then
        assertAll(
                () -> assertThat(KafkaDestination.key(EventEnvelope.added(clusterScoped))).isEqualTo("/node-1"),
                () -> assertThat(KafkaDestination.key(EventEnvelope.added(unnamed))).isEqualTo("default/")
        );
    }

    @Test
    void failed_send_is_logged_and_not_thrown() {
        // Given
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        KafkaDestination destination = new KafkaDestination(producer, "events", codec);

        // When
        destination.deliver(EventEnvelope.added(eventRecord("1")));

        // Then
        assertThat(producer.errorNext(new IllegalStateException("expected"))).isTrue();
    }

    @Test
    void close_flushes_and_closes_the_producer() {
        // Given
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDestination destination = new KafkaDestination(producer, "events", codec);

        // When
        destination.close();

        // Then
        assertThat(producer.closed()).isTrue();
    }

    @Test
    void producer_is_configured_with_string_serializers() {
        Map<String, Object> config = KafkaDestination.producerConfig(List.of("broker-1:9092", "broker-2:9092"), "eventrouter", "all");

        assertThat(config)
                .containsEntry(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, "broker-1:9092,broker-2:9092")
                .containsEntry(ProducerConfig.CLIENT_ID_CONFIG, "eventrouter")
                .containsEntry(ProducerConfig.ACKS_CONFIG, "all")
                .containsEntry(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    }

    @Test
    void brokers_are_required() {
        assertThatThrownBy(() -> KafkaDestination.producerConfig(List.of(), "eventrouter", "1"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("brokers cannot be empty");
    }

    private static EventRecord eventRecord(String position) {
        return new EventRecord(new ObjectIdentity("pod-a.17b", "default", position), "Normal", "Pulled", "Image pulled", 1,
                new SubjectReference("Pod", "pod-a", "default", "v1", "uid-1"), new EventOrigin("kubelet", "node-1"), null, null);
    }
}
