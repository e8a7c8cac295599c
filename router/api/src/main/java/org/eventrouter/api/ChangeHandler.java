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
 * The three callbacks through which a watch source hands change notifications to the router. Payloads are
 * untyped since the source doesn't guarantee their shape, a well-formed payload is a non-null {@link EventRecord}.
 */
public interface ChangeHandler {

    void onCreate(@Nullable Object record);

    void onUpdate(@Nullable Object oldRecord, @Nullable Object newRecord);

    void onDelete(@Nullable Object record);

    default void handle(ChangeNotification notification) {
        if (notification instanceof ChangeNotification.Created created) {
            onCreate(created.record());
        } else if (notification instanceof ChangeNotification.Updated updated) {
            onUpdate(updated.oldRecord(), updated.newRecord());
        } else if (notification instanceof ChangeNotification.Deleted deleted) {
            onDelete(deleted.record());
        } else {
            throw new IllegalArgumentException("Unsupported notification: " + notification);
        }
    }
}
