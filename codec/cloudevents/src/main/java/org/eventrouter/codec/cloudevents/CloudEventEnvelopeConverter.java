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

package org.eventrouter.codec.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import io.cloudevents.jackson.JsonFormat;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.SubjectReference;
import org.eventrouter.api.Verb;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * Converts an {@link EventEnvelope} into a {@link CloudEvent} (spec version 1.0) whose data is the envelope JSON
 * (content type {@value #DEFAULT_CONTENT_TYPE}), and back again.
 * <ul>
 *     <li>The cloud event type is {@code <type prefix>.added} or {@code <type prefix>.updated}</li>
 *     <li>The id is {@code <namespace>/<name>@<position>} of the event record, or a random UUID if the record has no identity</li>
 *     <li>The subject is {@code <kind>/<namespace>/<name>} of the involved object, if any</li>
 *     <li>The time is the last time the event was seen, falling back to now</li>
 * </ul>
 */
public class CloudEventEnvelopeConverter {
    public static final String DEFAULT_TYPE_PREFIX = "org.eventrouter.event";
    public static final URI DEFAULT_SOURCE = URI.create("urn:eventrouter");
    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final JacksonEnvelopeCodec codec;
    private final URI cloudEventSource;
    private final String typePrefix;
    private final Function<EventEnvelope, OffsetDateTime> timeMapper;
    private final JsonFormat jsonFormat = new JsonFormat();

    public CloudEventEnvelopeConverter(JacksonEnvelopeCodec codec) {
        this(codec, DEFAULT_SOURCE, DEFAULT_TYPE_PREFIX);
    }

    /**
     * @param codec            The codec used to convert the envelope to and from cloud event data
     * @param cloudEventSource The cloud event source
     * @param typePrefix       Prefix of the cloud event type, the lower case verb is appended to it
     */
    public CloudEventEnvelopeConverter(JacksonEnvelopeCodec codec, URI cloudEventSource, String typePrefix) {
        this(codec, cloudEventSource, typePrefix, CloudEventEnvelopeConverter::lastSeenOrNow);
    }

    CloudEventEnvelopeConverter(JacksonEnvelopeCodec codec, URI cloudEventSource, String typePrefix, Function<EventEnvelope, OffsetDateTime> timeMapper) {
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventSource, "cloudEventSource cannot be null");
        requireNonNull(typePrefix, "typePrefix cannot be null");
        requireNonNull(timeMapper, "timeMapper cannot be null");
        this.codec = codec;
        this.cloudEventSource = cloudEventSource;
        this.typePrefix = typePrefix;
        this.timeMapper = timeMapper;
    }

    public CloudEvent toCloudEvent(EventEnvelope envelope) {
        requireNonNull(envelope, EventEnvelope.class.getSimpleName() + " cannot be null");
        PojoCloudEventData<Map<String, Object>> cloudEventData = PojoCloudEventData.wrap(codec.toMap(envelope), codec::toJsonBytes);
        return CloudEventBuilder.v1()
                .withId(id(envelope.event()))
                .withSource(cloudEventSource)
                .withType(cloudEventType(envelope.verb()))
                .withTime(timeMapper.apply(envelope))
                .withSubject(subject(envelope.event()))
                .withDataContentType(DEFAULT_CONTENT_TYPE)
                .withData(cloudEventData)
                .build();
    }

    @SuppressWarnings("unchecked")
    public EventEnvelope toEnvelope(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        CloudEventData data = requireNonNull(cloudEvent.getData(), "cloud event data cannot be null");
        if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
            return codec.fromMap((Map<String, Object>) ((PojoCloudEventData<?>) data).getValue());
        }
        return codec.fromJson(data.toBytes());
    }

    /**
     * Serialize the envelope as a structured mode cloud event, content type {@value JsonFormat#CONTENT_TYPE}.
     */
    public byte[] toStructuredJson(EventEnvelope envelope) {
        return jsonFormat.serialize(toCloudEvent(envelope));
    }

    public EventEnvelope fromStructuredJson(byte[] json) {
        return toEnvelope(jsonFormat.deserialize(json));
    }

    public String cloudEventType(Verb verb) {
        return typePrefix + "." + verb.name().toLowerCase(Locale.ROOT);
    }

    private static String id(EventRecord event) {
        if (event.metadata() == null || event.metadata().name() == null) {
            return UUID.randomUUID().toString();
        }
        return event.metadata().namespace() + "/" + event.metadata().name() + "@" + event.positionToken();
    }

    private static @Nullable String subject(EventRecord event) {
        SubjectReference involvedObject = event.involvedObject();
        if (involvedObject == null) {
            return null;
        }
        return involvedObject.kind() + "/" + involvedObject.namespace() + "/" + involvedObject.name();
    }

    private static OffsetDateTime lastSeenOrNow(EventEnvelope envelope) {
        OffsetDateTime lastTimestamp = envelope.event().lastTimestamp();
        return lastTimestamp == null ? OffsetDateTime.now(UTC) : lastTimestamp;
    }
}
