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

import org.jspecify.annotations.Nullable;

/**
 * A pluggable consumer of {@link EventEnvelope}s.
 * <p>
 * {@code deliver} is synchronous from the caller's point of view but fire-and-forget: an implementation that fails
 * to deliver must report the failure through its own channel (typically an error log) and must not throw.
 * Retries, if any, are the implementation's own business.
 * </p>
 */
public interface EventDestination extends AutoCloseable {

    void deliver(EventEnvelope envelope);

    default void deliver(EventRecord newRecord, @Nullable EventRecord oldRecord) {
        deliver(EventEnvelope.of(newRecord, oldRecord));
    }

    /**
     * Release resources held by the destination, for example flushing buffered events. Does nothing by default.
     */
    @Override
    default void close() {
    }
}
