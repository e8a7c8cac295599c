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

/**
 * Thrown inside a destination when an envelope couldn't be delivered (serialization, network, quota).
 * Destinations catch and log it, it's never meant to escape {@link EventDestination#deliver(EventEnvelope)}.
 */
public class DestinationDeliveryException extends RuntimeException {

    public DestinationDeliveryException(String message) {
        super(message);
    }

    public DestinationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
