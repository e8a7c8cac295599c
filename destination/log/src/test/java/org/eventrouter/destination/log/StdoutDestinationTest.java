package org.eventrouter.destination.log;

import com.fasterxml.jackson.databind.JsonNode;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventrouter.destination.log.TestEvents.eventRecord;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Stdout destination")
@DisplayNameGeneration(ReplaceUnderscores.class)
class StdoutDestinationTest {

    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);

    @Test
    void writes_one_json_line_per_envelope() throws Exception {
        // Given
        StdoutDestination destination = new StdoutDestination(codec, "", out);

        // When
        destination.deliver(eventRecord("1", "Normal"), null);
        destination.deliver(eventRecord("2", "Normal"), eventRecord("1", "Normal"));

        // Then
        String[] lines = output.toString(StandardCharsets.UTF_8).split(System.lineSeparator());
        JsonNode first = codec.objectMapper().readTree(lines[0]);
        JsonNode second = codec.objectMapper().readTree(lines[1]);
        assertAll(
                () -> assertThat(lines).hasSize(2),
                () -> assertThat(first.get("verb").asText()).isEqualTo("ADDED"),
                () -> assertThat(first.has("oldEvent")).isFalse(),
                () -> assertThat(second.get("verb").asText()).isEqualTo("UPDATED"),
                () -> assertThat(second.get("oldEvent").get("metadata").get("resourceVersion").asText()).isEqualTo("1")
        );
    }

    @Test
    void wraps_envelope_in_json_namespace_when_configured() throws Exception {
        // Given
        StdoutDestination destination = new StdoutDestination(codec, "kubernetes", out);
        EventEnvelope envelope = EventEnvelope.added(eventRecord("1", "Normal"));

        // When
        destination.deliver(envelope);

        // Then
        JsonNode json = codec.objectMapper().readTree(output.toString(StandardCharsets.UTF_8));
        assertAll(
                () -> assertThat(json.size()).isEqualTo(1),
                () -> assertThat(json.get("kubernetes").get("verb").asText()).isEqualTo("ADDED"),
                () -> assertThat(codec.fromJson(json.get("kubernetes").toString())).isEqualTo(envelope)
        );
    }

    @Test
    void blank_json_namespace_means_no_namespace() {
        assertThat(new StdoutDestination(codec, "  ", out).jsonNamespace()).isNull();
    }
}
