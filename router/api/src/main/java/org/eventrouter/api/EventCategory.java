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
 * The categories an event record {@link EventRecord#type() type} is classified into. Any type that isn't
 * recognized is {@link #UNKNOWN}.
 */
public enum EventCategory {
    WARNING("Warning"), NORMAL("Normal"), INFO("Info"), UNKNOWN("");

    private final String type;

    EventCategory(String type) {
        this.type = type;
    }

    public static EventCategory of(@Nullable String type) {
        for (EventCategory category : values()) {
            if (category != UNKNOWN && category.type.equals(type)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
