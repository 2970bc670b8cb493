package com.automaker.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus(Runnable::run, EventBus.DEFAULT_QUEUE_CAPACITY);
    }

    @Test
    void featureSubscriberOnlyReceivesItsFeature() {
        List<AutomakerEvent> received = new ArrayList<>();
        bus.subscribe("f1", received::add);

        bus.publish(AutoModeEvents.progress("/p", "f1", "hello"));
        bus.publish(AutoModeEvents.progress("/p", "f2", "other"));

        assertEquals(1, received.size());
        assertEquals("f1", received.get(0).featureId());
        assertEquals("hello", received.get(0).payload().get("content"));
    }

    @Test
    void globalSubscriberReceivesLoopAndFeatureEvents() {
        List<AutomakerEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        bus.publish(AutoModeEvents.started("/p", 3));
        bus.publish(AutoModeEvents.featureStart("/p", "f1", "Add login", null, null));

        assertEquals(2, received.size());
        assertEquals(AutoModeEvents.STARTED, received.get(0).eventType());
        assertNull(received.get(0).featureId());
        assertEquals(AutoModeEvents.FEATURE_START, received.get(1).eventType());
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<AutomakerEvent> received = new ArrayList<>();
        EventBus.Subscription sub = bus.subscribe("f1", received::add);
        EventBus.Subscription global = bus.subscribeAll(received::add);

        sub.unsubscribe();
        global.unsubscribe();
        bus.publish(AutoModeEvents.progress("/p", "f1", "ignored"));

        assertTrue(received.isEmpty());
    }

    @Test
    void failingSubscriberDoesNotAffectOthersOrPublisher() {
        List<AutomakerEvent> received = new ArrayList<>();
        bus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
        bus.subscribeAll(received::add);

        assertDoesNotThrow(() -> bus.publish(AutoModeEvents.idle("/p")));
        assertEquals(1, received.size());
    }

    @Test
    void errorEventDefaultsMissingMessage() {
        AutomakerEvent event = AutoModeEvents.error("/p", "f1", null, AutoModeEvents.ERROR_TYPE_EXECUTION);

        assertEquals("Unknown error", event.payload().get("error"));
        assertEquals("execution", event.payload().get("errorType"));
    }

    @Test
    void lastFeatureUnsubscribeRemovesItsKey() {
        EventBus.Subscription first = bus.subscribe("f1", e -> { });
        EventBus.Subscription second = bus.subscribe("f1", e -> { });

        first.unsubscribe();
        assertTrue(bus.hasFeatureSubscribers("f1"));

        second.unsubscribe();
        assertFalse(bus.hasFeatureSubscribers("f1"));
    }

    @Test
    void publishDoesNotWaitForASlowSubscriber() throws Exception {
        EventBus async = new EventBus();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(1);
        async.subscribeAll(e -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            delivered.countDown();
        });
        try {
            long start = System.nanoTime();
            async.publish(AutoModeEvents.idle("/p"));
            async.publish(AutoModeEvents.idle("/p"));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 500, "publish blocked for " + elapsedMs + " ms");
            release.countDown();
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        } finally {
            async.shutdown();
        }
    }

    @Test
    void asyncDeliveryKeepsPublishOrderPerSubscriber() throws Exception {
        EventBus async = new EventBus();
        List<String> received = new CopyOnWriteArrayList<>();
        EventBus.Subscription sub = async.subscribe("f1", e -> received.add((String) e.payload().get("content")));
        try {
            List<String> sent = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                sent.add("chunk " + i);
                async.publish(AutoModeEvents.progress("/p", "f1", "chunk " + i));
            }

            assertTrue(sub.awaitDelivered(Duration.ofSeconds(5)));
            assertEquals(sent, received);
        } finally {
            async.shutdown();
        }
    }

    @Test
    void fullQueueDropsNewEventsInsteadOfBlocking() throws Exception {
        EventBus small = new EventBus(Executors.newSingleThreadExecutor(), 2);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> received = new CopyOnWriteArrayList<>();
        EventBus.Subscription sub = small.subscribe("f1", e -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            received.add((String) e.payload().get("content"));
        });
        try {
            small.publish(AutoModeEvents.progress("/p", "f1", "first"));
            assertTrue(holding.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 10; i++) {
                small.publish(AutoModeEvents.progress("/p", "f1", "burst " + i));
            }
            release.countDown();

            assertTrue(sub.awaitDelivered(Duration.ofSeconds(5)));
            assertEquals(List.of("first", "burst 0", "burst 1"), received);
        } finally {
            small.shutdown();
        }
    }
}
