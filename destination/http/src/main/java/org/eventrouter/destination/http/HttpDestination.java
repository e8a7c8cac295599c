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

package org.eventrouter.destination.http;

import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.cloudevents.CloudEventEnvelopeConverter;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.eventrouter.retry.RetryStrategy;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * Posts every envelope to an HTTP endpoint, either as plain JSON ({@code application/json}) or as a structured mode
 * CloudEvent ({@code application/cloudevents+json}).
 */
public class HttpDestination extends RestClientDestination {
    static final MediaType CLOUD_EVENTS_JSON = MediaType.parseMediaType("application/cloudevents+json");

    public enum Format {
        JSON, CLOUDEVENTS;

        public static Format parse(String format) {
            requireNonNull(format, "format cannot be null");
            String name = format.trim();
            for (Format candidate : values()) {
                if (candidate.name().equalsIgnoreCase(name)) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("Unsupported HTTP format: " + format + ", expecting json or cloudevents");
        }
    }

    private final URI endpoint;
    private final Format format;
    private final JacksonEnvelopeCodec codec;
    private final CloudEventEnvelopeConverter cloudEventConverter;

    public HttpDestination(RestClient restClient, URI endpoint, Format format, JacksonEnvelopeCodec codec, RetryStrategy retryStrategy) {
        this(restClient, endpoint, format, codec, new CloudEventEnvelopeConverter(codec), retryStrategy);
    }

    public HttpDestination(RestClient restClient, URI endpoint, Format format, JacksonEnvelopeCodec codec, CloudEventEnvelopeConverter cloudEventConverter, RetryStrategy retryStrategy) {
        super(restClient, retryStrategy);
        requireNonNull(endpoint, "endpoint cannot be null");
        requireNonNull(format, Format.class.getSimpleName() + " cannot be null");
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventConverter, CloudEventEnvelopeConverter.class.getSimpleName() + " cannot be null");
        this.endpoint = endpoint;
        this.format = format;
        this.codec = codec;
        this.cloudEventConverter = cloudEventConverter;
    }

    @Override
    protected Runnable prepare(EventEnvelope envelope) {
        final byte[] body;
        final MediaType contentType;
        if (format == Format.CLOUDEVENTS) {
            body = cloudEventConverter.toStructuredJson(envelope);
            contentType = CLOUD_EVENTS_JSON;
        } else {
            body = codec.toJsonBytes(envelope);
            contentType = MediaType.APPLICATION_JSON;
        }

        return () -> restClient.post()
                .uri(endpoint)
                .contentType(contentType)
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }
}
