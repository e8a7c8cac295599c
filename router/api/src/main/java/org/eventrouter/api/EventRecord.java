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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

/**
 * An event record as reported by the platform. Property names follow the platform's own event shape so that
 * the record serializes to the same JSON that downstream systems already know.
 *
 * @param metadata       Name, namespace and position token (resource version) of the event record
 * @param type           The category of the event, for example {@code Warning} or {@code Normal}
 * @param reason         Short machine readable reason
 * @param message        Human readable description
 * @param count          The number of times the event has occurred
 * @param involvedObject The object the event is about
 * @param source         The component and host that reported the event
 * @param firstTimestamp When the event was first seen
 * @param lastTimestamp  When the event was last seen
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventRecord(@Nullable ObjectIdentity metadata, @Nullable String type, @Nullable String reason,
                          @Nullable String message, int count, @Nullable SubjectReference involvedObject,
                          @Nullable EventOrigin source, @Nullable OffsetDateTime firstTimestamp,
                          @Nullable OffsetDateTime lastTimestamp) {

    /**
     * @return The position token of this record, or {@code null} if the record carries none.
     */
    @JsonIgnore
    public @Nullable String positionToken() {
        return metadata == null ? null : metadata.resourceVersion();
    }

    @JsonIgnore
    public EventCategory category() {
        return EventCategory.of(type);
    }
}
