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

package org.eventrouter.destination.log;

import org.eventrouter.api.DestinationDeliveryException;
import org.eventrouter.api.EventDestination;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Writes every envelope as one line of JSON to a {@link PrintStream}, {@code System.out} by default.
 * If a JSON namespace is configured the envelope is wrapped in an object with the namespace as its only key,
 * e.g. <code>{"kubernetes": {"verb": "ADDED", "event": {...}}}</code>.
 */
public class StdoutDestination implements EventDestination {
    private static final Logger log = LoggerFactory.getLogger(StdoutDestination.class);

    private final JacksonEnvelopeCodec codec;
    private final @Nullable String jsonNamespace;
    private final PrintStream out;

    public StdoutDestination(JacksonEnvelopeCodec codec, @Nullable String jsonNamespace) {
        this(codec, jsonNamespace, System.out);
    }

    public StdoutDestination(JacksonEnvelopeCodec codec, @Nullable String jsonNamespace, PrintStream out) {
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(out, PrintStream.class.getSimpleName() + " cannot be null");
        this.codec = codec;
        this.jsonNamespace = jsonNamespace == null || jsonNamespace.isBlank() ? null : jsonNamespace;
        this.out = out;
    }

    @Override
    public void deliver(EventEnvelope envelope) {
        try {
            out.println(toJson(envelope));
        } catch (RuntimeException e) {
            log.error("Failed to write {} event to stdout", envelope.verb(), new DestinationDeliveryException("Failed to serialize envelope", e));
        }
    }

    private String toJson(EventEnvelope envelope) {
        return jsonNamespace == null ? codec.toJson(envelope) : codec.toJson(Map.of(jsonNamespace, envelope));
    }

    public @Nullable String jsonNamespace() {
        return jsonNamespace;
    }

    @Override
    public void close() {
        out.flush();
    }
}
