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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Logs every envelope as JSON at INFO level to the {@value #EVENTS_LOGGER} logger, so that the logging backend decides
 * where the events end up.
 */
public class LogDestination implements EventDestination {
    public static final String EVENTS_LOGGER = "org.eventrouter.destination.log.events";

    private static final Logger log = LoggerFactory.getLogger(LogDestination.class);

    private final JacksonEnvelopeCodec codec;
    private final Logger events;

    public LogDestination(JacksonEnvelopeCodec codec) {
        this(codec, LoggerFactory.getLogger(EVENTS_LOGGER));
    }

    LogDestination(JacksonEnvelopeCodec codec, Logger events) {
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "events logger cannot be null");
        this.codec = codec;
        this.events = events;
    }

    @Override
    public void deliver(EventEnvelope envelope) {
        final String json;
        try {
            json = codec.toJson(envelope);
        } catch (RuntimeException e) {
            log.error("Failed to log {} event", envelope.verb(), new DestinationDeliveryException("Failed to serialize envelope", e));
            return;
        }
        events.info(json);
    }
}
