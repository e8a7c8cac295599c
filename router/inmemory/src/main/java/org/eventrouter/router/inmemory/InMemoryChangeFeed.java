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

package org.eventrouter.router.inmemory;

import org.eventrouter.api.ChangeHandler;
import org.eventrouter.api.ChangeNotification;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * An in-memory watch source. Notifications that are published to the feed are dispatched, in the order they were
 * published, to a {@link ChangeHandler} on a separate thread. Useful for tests and for applications that produce
 * change notifications themselves.
 */
public class InMemoryChangeFeed implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChangeFeed.class);

    private final ChangeHandler changeHandler;
    private final ExecutorService dispatcher;
    private final BlockingQueue<ChangeNotification> queue;
    private final Duration shutdownGracePeriod;
    private final CountDownLatch started = new CountDownLatch(1);

    private volatile boolean shutdown = false;

    /**
     * Create a new {@link InMemoryChangeFeed} that dispatches on a single thread and waits up to 5 seconds for an
     * in-flight notification on shutdown.
     */
    public InMemoryChangeFeed(ChangeHandler changeHandler) {
        this(changeHandler, Executors.newSingleThreadExecutor(r -> new Thread(r, "eventrouter-change-feed")), Duration.ofSeconds(5));
    }

    /**
     * @param changeHandler       The handler that receives the notifications
     * @param dispatcher          The {@link ExecutorService} that runs the dispatch loop
     * @param shutdownGracePeriod How long to wait for an in-flight notification before interrupting the dispatcher on shutdown
     */
    public InMemoryChangeFeed(ChangeHandler changeHandler, ExecutorService dispatcher, Duration shutdownGracePeriod) {
        if (changeHandler == null) {
            throw new IllegalArgumentException(ChangeHandler.class.getSimpleName() + " cannot be null");
        } else if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        } else if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod cannot be null or negative");
        }
        this.changeHandler = changeHandler;
        this.dispatcher = dispatcher;
        this.shutdownGracePeriod = shutdownGracePeriod;
        this.queue = new LinkedBlockingQueue<>();
        this.dispatcher.execute(this::dispatch);
    }

    /**
     * Publish a notification to the feed.
     *
     * @throws IllegalStateException If the feed has been shutdown.
     */
    public void publish(ChangeNotification notification) {
        if (shutdown) {
            throw new IllegalStateException("Cannot publish to " + InMemoryChangeFeed.class.getSimpleName() + " when shutdown");
        } else if (notification == null) {
            throw new IllegalArgumentException(ChangeNotification.class.getSimpleName() + " cannot be null");
        }
        queue.offer(notification);
    }

    public void created(@Nullable Object record) {
        publish(ChangeNotification.created(record));
    }

    public void updated(@Nullable Object oldRecord, @Nullable Object newRecord) {
        publish(ChangeNotification.updated(oldRecord, newRecord));
    }

    public void deleted(@Nullable Object record) {
        publish(ChangeNotification.deleted(record));
    }

    public boolean waitUntilStarted(Duration timeout) {
        try {
            return started.await(timeout.toMillis(), MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return The number of notifications that have been published but not yet dispatched.
     */
    public int pending() {
        return queue.size();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stop accepting notifications and shutdown the dispatcher. Notifications that are still queued are discarded,
     * a notification that is being dispatched is allowed to complete within the grace period.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        int discarded = queue.size();
        queue.clear();
        if (discarded > 0) {
            log.info("Discarding {} queued notification(s) on shutdown", discarded);
        }
        shutdownSafely(dispatcher, shutdownGracePeriod.toMillis(), MILLISECONDS);
    }

    @Override
    public void close() {
        shutdown();
    }

    private void dispatch() {
        started.countDown();
        while (!shutdown) {
            ChangeNotification notification;
            try {
                notification = queue.poll(500, MILLISECONDS);
            } catch (InterruptedException e) {
                continue;
            }

            if (notification != null) {
                try {
                    changeHandler.handle(notification);
                } catch (RuntimeException e) {
                    log.error("{} failed to handle {}", changeHandler.getClass().getSimpleName(), notification, e);
                }
            }
        }
    }

    private static void shutdownSafely(ExecutorService executorService, long timeout, TimeUnit unit) {
        if (!executorService.isShutdown() && !executorService.isTerminated()) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(timeout, unit)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                if (!executorService.isTerminated()) {
                    executorService.shutdownNow();
                }
                Thread.currentThread().interrupt();
            }
        }
    }
}
