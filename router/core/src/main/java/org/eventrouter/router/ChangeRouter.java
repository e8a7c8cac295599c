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

import org.eventrouter.api.ChangeHandler;
import org.eventrouter.api.DeliveryMetrics;
import org.eventrouter.api.EventDestination;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.MalformedNotificationException;
import org.eventrouter.api.PositionCheckpoint;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Receives change notifications from a watch source and forwards new information to a single {@link EventDestination}.
 * <p>
 * For created and updated records the router
 * <ol>
 *     <li>validates that the payload is an {@link EventRecord},</li>
 *     <li>tests the record's position token against its {@link PositionCursor} and drops replays,</li>
 *     <li>builds an {@link EventEnvelope} and delivers it to the destination on the calling thread,</li>
 *     <li>advances the cursor and invokes the {@link PositionCheckpoint},</li>
 *     <li>records the delivery in the {@link DeliveryMetrics}.</li>
 * </ol>
 * Steps 2 to 4 run while holding a lock so that concurrent dispatches never deliver the same position twice.
 * Deleted records are only logged, they're never forwarded and never move the cursor.
 * </p>
 * Malformed notifications are logged and dropped, no callback ever throws.
 */
public class ChangeRouter implements ChangeHandler {
    private static final Logger log = LoggerFactory.getLogger(ChangeRouter.class);

    private final EventDestination destination;
    private final PositionCursor cursor;
    private final PositionCheckpoint checkpoint;
    private final DeliveryMetrics metrics;
    private final Lock lock = new ReentrantLock();

    private volatile boolean running = true;

    public ChangeRouter(EventDestination destination) {
        this(destination, ChangeRouterConfig.defaults());
    }

    public ChangeRouter(EventDestination destination, ChangeRouterConfig config) {
        requireNonNull(destination, EventDestination.class.getSimpleName() + " cannot be null");
        requireNonNull(config, ChangeRouterConfig.class.getSimpleName() + " cannot be null");
        this.destination = destination;
        this.cursor = new PositionCursor(config.positionOrdering(), config.initialPosition());
        this.checkpoint = config.checkpoint();
        this.metrics = config.metrics();
    }

    @Override
    public void onCreate(@Nullable Object record) {
        if (isStopped("created")) {
            return;
        }
        if (!(record instanceof EventRecord newRecord)) {
            logMalformed("created", MalformedNotificationException.unexpectedPayload("new", record));
            return;
        }
        forward(EventEnvelope.added(newRecord));
    }

    @Override
    public void onUpdate(@Nullable Object oldRecord, @Nullable Object newRecord) {
        if (isStopped("updated")) {
            return;
        }
        if (!(newRecord instanceof EventRecord newEventRecord)) {
            logMalformed("updated", MalformedNotificationException.unexpectedPayload("new", newRecord));
            return;
        } else if (oldRecord != null && !(oldRecord instanceof EventRecord)) {
            logMalformed("updated", MalformedNotificationException.unexpectedPayload("old", oldRecord));
            return;
        }
        forward(EventEnvelope.updated((EventRecord) oldRecord, newEventRecord));
    }

    @Override
    public void onDelete(@Nullable Object record) {
        if (record instanceof EventRecord deleted) {
            log.debug("Event deleted from the system: {}", deleted);
        } else {
            MalformedNotificationException e = MalformedNotificationException.unexpectedPayload("deleted", record);
            log.debug("Ignoring malformed deleted notification: {}", e.getMessage());
        }
    }

    private void forward(EventEnvelope envelope) {
        String token = envelope.event().positionToken();
        boolean delivered;
        lock.lock();
        try {
            delivered = deliverIfAdmitted(envelope, token);
        } finally {
            lock.unlock();
        }

        if (delivered) {
            try {
                metrics.record(envelope.event());
            } catch (RuntimeException e) {
                log.debug("Failed to record metrics for event at position {}", token, e);
            }
        }
    }

    private boolean deliverIfAdmitted(EventEnvelope envelope, @Nullable String token) {
        if (token == null || !cursor.admit(token)) {
            log.trace("Dropping {} event at position {}, cursor is at {}", envelope.verb(), token, cursor.current().orElse("<empty>"));
            return false;
        }

        try {
            destination.deliver(envelope);
        } catch (RuntimeException e) {
            log.error("Destination {} failed to deliver {} event at position {}, position is not advanced", destination.getClass().getSimpleName(), envelope.verb(), token, e);
            return false;
        }

        cursor.advanceTo(token);
        try {
            checkpoint.checkpoint(token);
        } catch (RuntimeException e) {
            log.error("Failed to checkpoint position {}", token, e);
        }
        return true;
    }

    private boolean isStopped(String kind) {
        if (!running) {
            log.debug("Router is stopped, ignoring {} notification", kind);
            return true;
        }
        return false;
    }

    private static void logMalformed(String kind, MalformedNotificationException e) {
        log.warn("Dropping malformed {} notification: {}", kind, e.getMessage());
    }

    /**
     * @return The last delivered position, or empty if nothing has been delivered and no initial position was configured.
     */
    public Optional<String> currentPosition() {
        return cursor.current();
    }

    /**
     * Start accepting notifications again after a {@link #stop()}. A router is running when created.
     */
    public void start() {
        running = true;
    }

    /**
     * Stop accepting notifications. An in-flight delivery is not interrupted.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
