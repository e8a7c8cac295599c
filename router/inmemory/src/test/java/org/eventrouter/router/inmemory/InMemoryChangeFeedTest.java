package org.eventrouter.router.inmemory;

import org.eventrouter.api.ChangeHandler;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.ObjectIdentity;
import org.eventrouter.api.Verb;
import org.eventrouter.router.ChangeRouter;
import org.eventrouter.router.ChangeRouterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

@DisplayName("In-memory change feed")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
class InMemoryChangeFeedTest {

    private CopyOnWriteArrayList<EventEnvelope> delivered;
    private CopyOnWriteArrayList<String> checkpoints;
    private InMemoryChangeFeed feed;

    @BeforeEach
    void create_feed() {
        delivered = new CopyOnWriteArrayList<>();
        checkpoints = new CopyOnWriteArrayList<>();
        ChangeRouter router = new ChangeRouter(delivered::add, ChangeRouterConfig.defaults().checkpoint(checkpoints::add));
        feed = new InMemoryChangeFeed(router);
    }

    @AfterEach
    void shutdown() {
        feed.shutdown();
    }

    @Test
    void notifications_are_dispatched_to_router_in_publish_order() {
        // Given
        feed.waitUntilStarted(Duration.ofSeconds(2));

        // When
        feed.created(record("1000"));
        feed.created(record("1001"));
        feed.created(record("1000"));
        feed.updated(record("1001"), record("1002"));
        feed.deleted(record("1002"));

        // Then
        await().atMost(Duration.ofSeconds(2)).until(() -> checkpoints, contains("1000", "1001", "1002"));
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> delivered, hasSize(3));
        assertThat(delivered).extracting(EventEnvelope::verb).containsExactly(Verb.ADDED, Verb.ADDED, Verb.UPDATED);
    }

    @Test
    void failing_handler_does_not_stop_dispatching() {
        // Given
        CopyOnWriteArrayList<Object> handled = new CopyOnWriteArrayList<>();
        InMemoryChangeFeed failingFeed = new InMemoryChangeFeed(new ThrowingOnFirstCreateHandler(handled));

        try {
            // When
            failingFeed.created(record("1"));
            failingFeed.created(record("2"));

            // Then
            await().atMost(Duration.ofSeconds(2)).until(() -> handled, hasSize(1));
            assertThat(handled).containsExactly(record("2"));
        } finally {
            failingFeed.shutdown();
        }
    }

    @Test
    void cannot_publish_after_shutdown() {
        // When
        feed.shutdown();

        // Then
        assertThatThrownBy(() -> feed.created(record("1")))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Cannot publish to InMemoryChangeFeed when shutdown");
    }

    @Test
    void shutdown_waits_for_in_flight_notification() throws InterruptedException {
        // Given
        CountDownLatch deliveryStarted = new CountDownLatch(1);
        CopyOnWriteArrayList<EventEnvelope> slowlyDelivered = new CopyOnWriteArrayList<>();
        ChangeRouter router = new ChangeRouter(envelope -> {
            deliveryStarted.countDown();
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            slowlyDelivered.add(envelope);
        });
        InMemoryChangeFeed slowFeed = new InMemoryChangeFeed(router, Executors.newSingleThreadExecutor(), Duration.ofSeconds(2));
        slowFeed.created(record("1"));
        deliveryStarted.await();

        // When
        slowFeed.shutdown();

        // Then
        assertThat(slowlyDelivered).hasSize(1);
        await().atMost(Duration.ofSeconds(1)).until(slowFeed::isShutdown, is(true));
    }

    private static EventRecord record(String position) {
        return new EventRecord(new ObjectIdentity("pod.1", "default", position), "Normal", "Started", "started", 1, null, null, null, null);
    }

    private static class ThrowingOnFirstCreateHandler implements ChangeHandler {
        private final CopyOnWriteArrayList<Object> handled;
        private boolean thrown;

        ThrowingOnFirstCreateHandler(CopyOnWriteArrayList<Object> handled) {
            this.handled = handled;
        }

        @Override
        public void onCreate(Object record) {
            if (!thrown) {
                thrown = true;
                throw new IllegalStateException("expected");
            }
            handled.add(record);
        }

        @Override
        public void onUpdate(Object oldRecord, Object newRecord) {
        }

        @Override
        public void onDelete(Object record) {
        }
    }
}
