package com.automaker.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for auto-mode events.
 * <p>
 * Supports per-feature subscriptions and global subscriptions that receive all events.
 * Publishing never waits on a subscriber: each subscription owns a bounded queue drained on
 * the delivery executor, one event at a time and in publish order. When a subscriber falls
 * {@code queueCapacity} events behind, further events for it are dropped and logged.
 * A failing subscriber is logged and skipped, never propagated to the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final Executor deliveryExecutor;
    private final int queueCapacity;

    /** Per-feature subscribers keyed by featureId; a key is removed with its last subscriber. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Mailbox>> featureSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events for all features. */
    private final CopyOnWriteArrayList<Mailbox> globalSubscribers = new CopyOnWriteArrayList<>();

    public EventBus() {
        this(Executors.newCachedThreadPool(deliveryThreads()), DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * @param deliveryExecutor runs subscriber callbacks; {@code Runnable::run} delivers inline
     * @param queueCapacity    events buffered per subscriber before dropping
     */
    public EventBus(Executor deliveryExecutor, int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.deliveryExecutor = deliveryExecutor;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Publish an event to all matching subscribers (feature-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(AutomakerEvent event) {
        log.debug("Publishing event: {} for feature {}", event.eventType(), event.featureId());

        if (event.featureId() != null) {
            CopyOnWriteArrayList<Mailbox> featureSubs = featureSubscribers.get(event.featureId());
            if (featureSubs != null) {
                for (Mailbox mailbox : featureSubs) {
                    mailbox.offer(event);
                }
            }
        }

        for (Mailbox mailbox : globalSubscribers) {
            mailbox.offer(event);
        }
    }

    /**
     * Subscribe to events for a specific feature.
     *
     * @param featureId the feature to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String featureId, Consumer<AutomakerEvent> consumer) {
        Mailbox mailbox = new Mailbox(consumer);
        featureSubscribers.compute(featureId, (key, subs) -> {
            CopyOnWriteArrayList<Mailbox> list = subs != null ? subs : new CopyOnWriteArrayList<>();
            list.add(mailbox);
            return list;
        });
        mailbox.onUnsubscribe = () -> featureSubscribers.computeIfPresent(featureId, (key, subs) -> {
            subs.remove(mailbox);
            return subs.isEmpty() ? null : subs;
        });
        log.debug("Subscribed to feature {}", featureId);
        return mailbox;
    }

    /**
     * Subscribe to events from all features and the loop itself.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AutomakerEvent> consumer) {
        Mailbox mailbox = new Mailbox(consumer);
        mailbox.onUnsubscribe = () -> globalSubscribers.remove(mailbox);
        globalSubscribers.add(mailbox);
        log.debug("Subscribed to all events (global)");
        return mailbox;
    }

    boolean hasFeatureSubscribers(String featureId) {
        return featureSubscribers.containsKey(featureId);
    }

    @PreDestroy
    public void shutdown() {
        if (deliveryExecutor instanceof ExecutorService executor) {
            executor.shutdown();
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    public interface Subscription {

        /** Stops delivery. Events still queued for this subscriber are discarded. */
        void unsubscribe();

        /**
         * Blocks until every event queued for this subscriber so far has been handed to it.
         *
         * @return false when the timeout elapsed first
         */
        boolean awaitDelivered(Duration timeout) throws InterruptedException;
    }

    private final class Mailbox implements Subscription {

        private final Consumer<AutomakerEvent> consumer;
        private final BlockingQueue<AutomakerEvent> queue;
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicInteger dropped = new AtomicInteger();
        private volatile boolean active = true;
        private volatile Runnable onUnsubscribe;

        Mailbox(Consumer<AutomakerEvent> consumer) {
            this.consumer = consumer;
            this.queue = new ArrayBlockingQueue<>(queueCapacity);
        }

        void offer(AutomakerEvent event) {
            if (!active) {
                return;
            }
            if (!queue.offer(event)) {
                int count = dropped.incrementAndGet();
                log.warn("Subscriber is {} events behind, dropped {} for feature {} ({} dropped so far)",
                        queueCapacity, event.eventType(), event.featureId(), count);
                return;
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                queue.clear();
                log.debug("Event delivery executor is shut down; discarding queued events");
                signalIdle();
            }
        }

        private void drain() {
            try {
                AutomakerEvent event;
                while (active && (event = queue.poll()) != null) {
                    deliverSafely(consumer, event);
                }
            } finally {
                draining.set(false);
                signalIdle();
            }
            // events offered after the last poll
            if (active && !queue.isEmpty()) {
                scheduleDrain();
            }
        }

        private synchronized void signalIdle() {
            notifyAll();
        }

        private boolean idle() {
            return !draining.get() && (queue.isEmpty() || !active);
        }

        @Override
        public synchronized boolean awaitDelivered(Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (!idle()) {
                long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
                if (remainingMs <= 0) {
                    return false;
                }
                wait(remainingMs);
            }
            return true;
        }

        @Override
        public void unsubscribe() {
            active = false;
            queue.clear();
            Runnable hook = onUnsubscribe;
            if (hook != null) {
                hook.run();
            }
            signalIdle();
        }
    }

    private void deliverSafely(Consumer<AutomakerEvent> subscriber, AutomakerEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    private static ThreadFactory deliveryThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "event-delivery-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
