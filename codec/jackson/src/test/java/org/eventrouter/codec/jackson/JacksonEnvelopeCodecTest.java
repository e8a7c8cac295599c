package org.eventrouter.codec.jackson;

import org.eventrouter.api.EventEnvelope;
import org.eventrouter.api.EventOrigin;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.ObjectIdentity;
import org.eventrouter.api.SubjectReference;
import org.eventrouter.api.Verb;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Jackson envelope codec")
@DisplayNameGeneration(ReplaceUnderscores.class)
class JacksonEnvelopeCodecTest {

    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();

    @Test
    void updated_envelope_survives_serialization_with_both_records() {
        // Given
        EventEnvelope envelope = EventEnvelope.updated(eventRecord("150", ZoneOffset.ofHours(2)), eventRecord("200", ZoneOffset.UTC));

        // When
        EventEnvelope deserialized = codec.fromJson(codec.toJsonBytes(envelope));

        // Then
        assertThat(deserialized).isEqualTo(envelope);
    }

    @Test
    void added_envelope_survives_serialization_without_old_event() {
        // Given
        EventEnvelope envelope = EventEnvelope.added(eventRecord("1000", ZoneOffset.UTC));

        // When
        String json = codec.toJson(envelope);
        EventEnvelope deserialized = codec.fromJson(json);

        // Then
        assertAll(
                () -> assertThat(json).doesNotContain("oldEvent"),
                () -> assertThat(deserialized.verb()).isEqualTo(Verb.ADDED),
                () -> assertThat(deserialized.event()).isEqualTo(envelope.event()),
                () -> assertThat(deserialized.oldEvent()).isNull()
        );
    }

    @SuppressWarnings("unchecked")
    @Test
    void envelope_is_written_with_the_platform_event_property_names() {
        // Given
        EventEnvelope envelope = EventEnvelope.added(eventRecord("1000", ZoneOffset.UTC));

        // When
        Map<String, Object> map = codec.toMap(envelope);

        // Then
        Map<String, Object> event = (Map<String, Object>) map.get("event");
        assertAll(
                () -> assertThat(map).containsOnlyKeys("verb", "event").containsEntry("verb", "ADDED"),
                () -> assertThat(event).containsKeys("metadata", "type", "reason", "message", "count", "involvedObject", "source", "firstTimestamp", "lastTimestamp"),
                () -> assertThat(event).doesNotContainKeys("positionToken", "category"),
                () -> assertThat(event).containsEntry("lastTimestamp", "2024-03-01T12:00:00Z"),
                () -> assertThat((Map<String, Object>) event.get("metadata")).containsEntry("resourceVersion", "1000")
        );
    }

    @Test
    void invalid_json_is_thrown_as_unchecked_io_exception() {
        assertThatThrownBy(() -> codec.fromJson("{not json")).isInstanceOf(UncheckedIOException.class);
    }

    static EventRecord eventRecord(String position, ZoneOffset offset) {
        OffsetDateTime time = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, offset);
        return new EventRecord(new ObjectIdentity("pod-a.17b", "default", position), "Warning", "BackOff", "Back-off restarting failed container", 3,
                new SubjectReference("Pod", "pod-a", "default", "v1", "8c1b-11e9"), new EventOrigin("kubelet", "node-1"), time, time);
    }
}
