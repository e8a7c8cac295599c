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
 * Describes a change notification whose payload isn't an {@link EventRecord}, or is missing.
 */
public class MalformedNotificationException extends RuntimeException {

    public MalformedNotificationException(String message) {
        super(message);
    }

    public static MalformedNotificationException unexpectedPayload(String role, @Nullable Object payload) {
        if (payload == null) {
            return new MalformedNotificationException("The " + role + " payload is missing");
        }
        return new MalformedNotificationException("The " + role + " payload is not an " + EventRecord.class.getSimpleName()
                + " but " + payload.getClass().getName());
    }
}
