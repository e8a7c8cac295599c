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

package org.eventrouter.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The destination agnostic unit that is handed to an {@link EventDestination}. Serializes to
 * <pre>
 * { "verb": "ADDED" | "UPDATED", "event": {...}, "oldEvent": {...} }
 * </pre>
 * where {@code oldEvent} is omitted when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope(Verb verb, EventRecord event, @Nullable EventRecord oldEvent) {

    public EventEnvelope {
        requireNonNull(verb, Verb.class.getSimpleName() + " cannot be null");
        requireNonNull(event, "event cannot be null");
    }

    /**
     * Create an envelope for a new record. The verb is {@link Verb#UPDATED} if {@code oldRecord} is present and
     * {@link Verb#ADDED} otherwise.
     */
    public static EventEnvelope of(EventRecord newRecord, @Nullable EventRecord oldRecord) {
        return new EventEnvelope(oldRecord == null ? Verb.ADDED : Verb.UPDATED, newRecord, oldRecord);
    }

    public static EventEnvelope added(EventRecord newRecord) {
        return new EventEnvelope(Verb.ADDED, newRecord, null);
    }

    public static EventEnvelope updated(@Nullable EventRecord oldRecord, EventRecord newRecord) {
        return new EventEnvelope(Verb.UPDATED, newRecord, oldRecord);
    }
}
