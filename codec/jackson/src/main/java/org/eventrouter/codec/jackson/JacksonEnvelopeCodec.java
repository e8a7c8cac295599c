/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventrouter.codec.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.eventrouter.api.EventEnvelope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Converts {@link EventEnvelope}s to and from JSON using a Jackson {@link ObjectMapper}. Timestamps are written as
 * ISO-8601 strings and keep their offset when read back.
 * <p>
 * Serialization failures are thrown as {@link UncheckedIOException}.
 * </p>
 */
public class JacksonEnvelopeCodec {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Create a new instance of the {@link JacksonEnvelopeCodec} that uses {@link #defaultObjectMapper()}.
     */
    public JacksonEnvelopeCodec() {
        this(defaultObjectMapper());
    }

    /**
     * @param objectMapper The ObjectMapper instance to use. It must be able to handle {@code java.time} types.
     */
    public JacksonEnvelopeCodec(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    /**
     * @return An {@link ObjectMapper} with the {@link JavaTimeModule} registered, that writes dates as ISO-8601 strings
     * and doesn't adjust offsets when reading them.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(Object value) {
        requireNonNull(value, "value cannot be null");
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public byte[] toJsonBytes(Object value) {
        requireNonNull(value, "value cannot be null");
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Convert the envelope into a generic map with the same structure as its JSON representation.
     */
    public Map<String, Object> toMap(EventEnvelope envelope) {
        requireNonNull(envelope, EventEnvelope.class.getSimpleName() + " cannot be null");
        return objectMapper.convertValue(envelope, MAP_TYPE);
    }

    public EventEnvelope fromMap(Map<String, Object> map) {
        requireNonNull(map, "map cannot be null");
        return objectMapper.convertValue(map, EventEnvelope.class);
    }

    public EventEnvelope fromJson(String json) {
        requireNonNull(json, "json cannot be null");
        try {
            return objectMapper.readValue(json, EventEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public EventEnvelope fromJson(byte[] json) {
        requireNonNull(json, "json cannot be null");
        try {
            return objectMapper.readValue(json, EventEnvelope.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
