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
import org.eventrouter.api.EventOrigin;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.SubjectReference;
import org.eventrouter.retry.RetryStrategy;
import org.jspecify.annotations.Nullable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Writes one point per envelope to InfluxDB using the line protocol ({@code /write?db=<database>&precision=ms}).
 * <p>
 * The point is tagged with the kind, name and namespace of the involved object, the reason, the type and the source
 * host. Its fields are {@code count}, {@code message} and {@code verb} and its timestamp is the time the event was
 * last seen, or now if unknown.
 * </p>
 */
public class InfluxDbDestination extends RestClientDestination {
    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final URI writeEndpoint;
    private final String measurement;
    private final @Nullable String authorization;
    private final Clock clock;

    public InfluxDbDestination(RestClient restClient, String url, String database, String measurement,
                               @Nullable String username, @Nullable String password, RetryStrategy retryStrategy) {
        this(restClient, url, database, measurement, username, password, retryStrategy, Clock.systemUTC());
    }

    InfluxDbDestination(RestClient restClient, String url, String database, String measurement,
                        @Nullable String username, @Nullable String password, RetryStrategy retryStrategy, Clock clock) {
        super(restClient, retryStrategy);
        requireNonNull(url, "url cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database cannot be null or blank");
        } else if (measurement == null || measurement.isBlank()) {
            throw new IllegalArgumentException("measurement cannot be null or blank");
        }
        this.writeEndpoint = UriComponentsBuilder.fromHttpUrl(url).path("/write")
                .queryParam("db", database)
                .queryParam("precision", "ms")
                .build().toUri();
        this.measurement = measurement;
        this.authorization = username == null || username.isBlank() ? null :
                "Basic " + Base64.getEncoder().encodeToString((username + ":" + (password == null ? "" : password)).getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    @Override
    protected Runnable prepare(EventEnvelope envelope) {
        byte[] body = toLineProtocol(envelope).getBytes(StandardCharsets.UTF_8);
        return () -> restClient.post()
                .uri(writeEndpoint)
                .headers(headers -> {
                    if (authorization != null) {
                        headers.set(HttpHeaders.AUTHORIZATION, authorization);
                    }
                })
                .contentType(TEXT_PLAIN_UTF8)
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }

    String toLineProtocol(EventEnvelope envelope) {
        EventRecord event = envelope.event();
        SubjectReference involvedObject = event.involvedObject();
        EventOrigin source = event.source();

        Map<String, @Nullable String> tags = new LinkedHashMap<>();
        tags.put("kind", involvedObject == null ? null : involvedObject.kind());
        tags.put("name", involvedObject == null ? null : involvedObject.name());
        tags.put("namespace", involvedObject == null ? null : involvedObject.namespace());
        tags.put("reason", event.reason());
        tags.put("type", event.type());
        tags.put("source", source == null ? null : source.host());

        StringBuilder line = new StringBuilder(escapeKey(measurement));
        // Line protocol doesn't allow empty tag values
        tags.forEach((key, value) -> {
            if (value != null && !value.isEmpty()) {
                line.append(',').append(key).append('=').append(escapeKey(value));
            }
        });
        line.append(" count=").append(event.count()).append('i')
                .append(",message=").append(quote(event.message()))
                .append(",verb=").append(quote(envelope.verb().name()))
                .append(' ').append(timestampMillis(event));
        return line.toString();
    }

    private long timestampMillis(EventRecord event) {
        OffsetDateTime lastTimestamp = event.lastTimestamp();
        return lastTimestamp == null ? clock.millis() : lastTimestamp.toInstant().toEpochMilli();
    }

    private static String escapeKey(String value) {
        return value.replace("\\", "\\\\").replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ")
                .replace("\n", "\\n");
    }

    private static String quote(@Nullable String value) {
        String text = value == null ? "" : value;
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
