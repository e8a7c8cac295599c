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

package org.eventrouter.router;

import org.eventrouter.api.DeliveryMetrics;
import org.eventrouter.api.PositionCheckpoint;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the {@link ChangeRouter}. Immutable, every method returns a new instance:
 * <pre>
 * ChangeRouterConfig config = ChangeRouterConfig.defaults()
 *         .positionOrdering(PositionOrdering.NUMERIC)
 *         .initialPosition(storage.read(routerId))
 *         .checkpoint(token -> storage.save(routerId, token));
 * </pre>
 */
public final class ChangeRouterConfig {
    private final PositionOrdering positionOrdering;
    private final @Nullable String initialPosition;
    private final PositionCheckpoint checkpoint;
    private final DeliveryMetrics metrics;

    private ChangeRouterConfig(PositionOrdering positionOrdering, @Nullable String initialPosition, PositionCheckpoint checkpoint, DeliveryMetrics metrics) {
        requireNonNull(positionOrdering, PositionOrdering.class.getSimpleName() + " cannot be null");
        requireNonNull(checkpoint, PositionCheckpoint.class.getSimpleName() + " cannot be null");
        requireNonNull(metrics, DeliveryMetrics.class.getSimpleName() + " cannot be null");
        this.positionOrdering = positionOrdering;
        this.initialPosition = initialPosition;
        this.checkpoint = checkpoint;
        this.metrics = metrics;
    }

    /**
     * Numeric ordering, empty initial position, no checkpoint and metrics disabled.
     */
    public static ChangeRouterConfig defaults() {
        return new ChangeRouterConfig(PositionOrdering.NUMERIC, null, PositionCheckpoint.none(), DeliveryMetrics.disabled());
    }

    public ChangeRouterConfig positionOrdering(PositionOrdering positionOrdering) {
        return new ChangeRouterConfig(positionOrdering, initialPosition, checkpoint, metrics);
    }

    public ChangeRouterConfig initialPosition(@Nullable String initialPosition) {
        return new ChangeRouterConfig(positionOrdering, initialPosition, checkpoint, metrics);
    }

    public ChangeRouterConfig checkpoint(PositionCheckpoint checkpoint) {
        return new ChangeRouterConfig(positionOrdering, initialPosition, checkpoint, metrics);
    }

    public ChangeRouterConfig metrics(DeliveryMetrics metrics) {
        return new ChangeRouterConfig(positionOrdering, initialPosition, checkpoint, metrics);
    }

    public PositionOrdering positionOrdering() {
        return positionOrdering;
    }

    public @Nullable String initialPosition() {
        return initialPosition;
    }

    public PositionCheckpoint checkpoint() {
        return checkpoint;
    }

    public DeliveryMetrics metrics() {
        return metrics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeRouterConfig)) return false;
        ChangeRouterConfig that = (ChangeRouterConfig) o;
        return positionOrdering == that.positionOrdering && Objects.equals(initialPosition, that.initialPosition)
                && Objects.equals(checkpoint, that.checkpoint) && Objects.equals(metrics, that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positionOrdering, initialPosition, checkpoint, metrics);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ChangeRouterConfig.class.getSimpleName() + "[", "]")
                .add("positionOrdering=" + positionOrdering)
                .add("initialPosition='" + initialPosition + "'")
                .toString();
    }
}
