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

package org.eventrouter.destination.http;

import org.eventrouter.api.DestinationDeliveryException;
import org.eventrouter.api.EventDestination;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Base class for destinations that post envelopes using a {@link RestClient}. Requests that fail with a
 * {@link RestClientException} are retried according to the {@link RetryStrategy}, the final failure is logged.
 */
public abstract class RestClientDestination implements EventDestination {
    private static final Logger log = LoggerFactory.getLogger(RestClientDestination.class);

    protected final RestClient restClient;
    private final RetryStrategy retryStrategy;

    protected RestClientDestination(RestClient restClient, RetryStrategy retryStrategy) {
        requireNonNull(restClient, RestClient.class.getSimpleName() + " cannot be null");
        requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        this.restClient = restClient;
        this.retryStrategy = retryStrategy instanceof RetryStrategy.Retry retry ?
                retry.retryIf(RestClientException.class::isInstance)
                        .onError((attempt, throwable) -> log.debug("{} attempt {} failed: {}", getClass().getSimpleName(), attempt, throwable.getMessage())) :
                retryStrategy;
    }

    /**
     * Exponential backoff from {@code initialBackoff} to {@code maxBackoff} with the given number of attempts.
     */
    public static RetryStrategy defaultRetryStrategy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        return RetryStrategy.exponentialBackoff(initialBackoff, maxBackoff, 2.0).maxAttempts(maxAttempts);
    }

    @Override
    public void deliver(EventEnvelope envelope) {
        final Runnable request;
        try {
            request = prepare(envelope);
        } catch (RuntimeException e) {
            log.error("{} failed to prepare {} event", getClass().getSimpleName(), envelope.verb(), new DestinationDeliveryException("Failed to serialize envelope", e));
            return;
        }

        try {
            retryStrategy.execute(request);
        } catch (RuntimeException e) {
            log.error("{} failed to deliver {} event at position {}", getClass().getSimpleName(), envelope.verb(), envelope.event().positionToken(),
                    new DestinationDeliveryException(e.getMessage() == null ? "Request failed" : e.getMessage(), e));
        }
    }

    /**
     * Serialize the envelope and return the request that sends it. The request is invoked once per attempt.
     */
    protected abstract Runnable prepare(EventEnvelope envelope);
}
