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
 * Side channel that counts delivered event records per {@link EventCategory}. Implementations must never throw
 * and must not block the caller for any significant time.
 */
@FunctionalInterface
public interface DeliveryMetrics {

    /**
     * Count the given record. A {@code null} record is ignored.
     */
    void record(@Nullable EventRecord record);

    static DeliveryMetrics disabled() {
        return __ -> {
        };
    }
}
