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

package org.eventrouter.springboot;

import org.eventrouter.api.EventDestination;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.springframework.web.client.RestClient;

/**
 * Creates the {@link EventDestination} that is registered for a sink name in the {@link DestinationRegistry}.
 */
@FunctionalInterface
public interface DestinationFactory {

    EventDestination create(Context context);

    /**
     * What a factory may use to create its destination.
     *
     * @param properties        The bound {@code eventrouter.*} properties
     * @param codec             The codec to serialize envelopes with
     * @param restClientBuilder A builder for destinations that talk HTTP. Clone it before customizing.
     */
    record Context(EventRouterProperties properties, JacksonEnvelopeCodec codec, RestClient.Builder restClientBuilder) {
    }
}
