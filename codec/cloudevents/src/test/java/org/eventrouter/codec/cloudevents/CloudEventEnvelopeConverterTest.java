package org.eventrouter.codec.cloudevents;

import com.fasterxml.jackson.databind.JsonNode;
import io.cloudevents.CloudEvent;
import io.cloudevents.jackson.JsonFormat;
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

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("CloudEvent envelope converter")
@DisplayNameGeneration(ReplaceUnderscores.class)
class CloudEventEnvelopeConverterTest {

    private static final OffsetDateTime LAST_SEEN = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();
    private final CloudEventEnvelopeConverter converter = new CloudEventEnvelopeConverter(codec, URI.create("urn:eventrouter:test"), "com.example.event");

    @Test
    void converts_updated_envelope_to_cloud_event() {
        // Given
        EventEnvelope envelope = EventEnvelope.updated(eventRecord("150"), eventRecord("200"));

        // When
        CloudEvent cloudEvent = converter.toCloudEvent(envelope);

        // Then
        assertAll(
                () -> assertThat(cloudEvent.getId()).isEqualTo("default/pod-a.17b@200"),
                () -> assertThat(cloudEvent.getSource()).isEqualTo(URI.create("urn:eventrouter:test")),
                () -> assertThat(cloudEvent.getType()).isEqualTo("com.example.event.updated"),
                () -> assertThat(cloudEvent.getSubject()).isEqualTo("Pod/default/pod-a"),
                () -> assertThat(cloudEvent.getTime()).isEqualTo(LAST_SEEN),
                () -> assertThat(cloudEvent.getDataContentType()).isEqualTo("application/json"),
                () -> assertThat(converter.toEnvelope(cloudEvent)).isEqualTo(envelope)
        );
    }

    @Test
    void structured_json_contains_envelope_as_data() throws Exception {
        // Given
        EventEnvelope envelope = EventEnvelope.added(eventRecord("1000"));

        // When
        byte[] json = converter.toStructuredJson(envelope);

        // Then
        JsonNode node = codec.objectMapper().readTree(json);
        assertAll(
                () -> assertThat(node.get("specversion").asText()).isEqualTo("1.0"),
                () -> assertThat(node.get("type").asText()).isEqualTo("com.example.event.added"),
                () -> assertThat(node.get("data").get("verb").asText()).isEqualTo("ADDED"),
                () -> assertThat(node.get("data").get("event").get("metadata").get("resourceVersion").asText()).isEqualTo("1000"),
                () -> assertThat(converter.fromStructuredJson(json)).isEqualTo(envelope),
                () -> assertThat(JsonFormat.CONTENT_TYPE).isEqualTo("application/cloudevents+json")
        );
    }

    private static EventRecord eventRecord(String position) {
        return new EventRecord(new ObjectIdentity("pod-a.17b", "default", position), "Normal", "Pulled", "Image pulled", 1,
                new SubjectReference("Pod", "pod-a", "default", "v1", "uid-1"), new EventOrigin("kubelet", "node-1"), LAST_SEEN.minusMinutes(5), LAST_SEEN);
    }
}
