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
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.eventrouter.retry.RetryStrategy;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Adds every envelope as a document to a Rockset collection using the document API, so that the events can be queried
 * from analytics tools.
 */
public class RocksetDestination extends RestClientDestination {
    public static final String DEFAULT_API_SERVER = "https://api.rs2.usw2.rockset.com";

    private final URI documentsEndpoint;
    private final String apiKey;
    private final JacksonEnvelopeCodec codec;

    public RocksetDestination(RestClient restClient, String apiServer, String apiKey, String workspace, String collection,
                              JacksonEnvelopeCodec codec, RetryStrategy retryStrategy) {
        super(restClient, retryStrategy);
        requireNonNull(apiServer, "apiServer cannot be null");
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey cannot be null or blank");
        } else if (workspace == null || workspace.isBlank()) {
            throw new IllegalArgumentException("workspace cannot be null or blank");
        } else if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        this.documentsEndpoint = documentsEndpoint(apiServer, workspace, collection);
        this.apiKey = apiKey;
        this.codec = codec;
    }

    static URI documentsEndpoint(String apiServer, String workspace, String collection) {
        String base = apiServer.endsWith("/") ? apiServer.substring(0, apiServer.length() - 1) : apiServer;
        return URI.create(base + "/v1/orgs/self/ws/" + workspace + "/collections/" + collection + "/docs");
    }

    @Override
    protected Runnable prepare(EventEnvelope envelope) {
        byte[] body = codec.toJsonBytes(Map.of("data", List.of(codec.toMap(envelope))));
        return () -> restClient.post()
                .uri(documentsEndpoint)
                .header(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }
}
