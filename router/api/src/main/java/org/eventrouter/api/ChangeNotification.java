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
 * A change reported by a watch source.
 */
public sealed interface ChangeNotification {

    static ChangeNotification created(@Nullable Object record) {
        return new Created(record);
    }

    static ChangeNotification updated(@Nullable Object oldRecord, @Nullable Object newRecord) {
        return new Updated(oldRecord, newRecord);
    }

    static ChangeNotification deleted(@Nullable Object record) {
        return new Deleted(record);
    }

    record Created(@Nullable Object record) implements ChangeNotification {
    }

    record Updated(@Nullable Object oldRecord, @Nullable Object newRecord) implements ChangeNotification {
    }

    record Deleted(@Nullable Object record) implements ChangeNotification {
    }
}
