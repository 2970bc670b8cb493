package com.automaker.dispatch.api;

import com.automaker.core.events.AutoModeEvents;
import com.automaker.core.events.AutomakerEvent;
import com.automaker.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = spy(new EventBus());
        service = new SseStreamingService(eventBus, 60_000L);
    }

    private static AutomakerEvent progress(String featureId, String content) {
        return new AutomakerEvent(AutoModeEvents.PROGRESS, "/tmp/shop", featureId,
                Map.of("content", content), Instant.now());
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("feature-scoped emitter subscribes to that feature only")
        void featureScopedSubscription() {
            SseEmitter emitter = service.createEmitter("login");

            assertNotNull(emitter);
            verify(eventBus).subscribe(eq("login"), any());
            verify(eventBus, never()).subscribeAll(any());
        }

        @Test
        @DisplayName("unscoped emitter subscribes to every event")
        void globalSubscription() {
            service.createEmitter(null);

            verify(eventBus).subscribeAll(any());
            verify(eventBus, never()).subscribe(any(), any());
        }

        @Test
        @DisplayName("each call yields a distinct emitter")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter("login");
            SseEmitter second = service.createEmitter("login");

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("activeEmitterCount")
    class ActiveCountTests {

        @Test
        @DisplayName("starts at zero")
        void startsAtZero() {
            assertEquals(0, service.activeEmitterCount());
        }

        @Test
        @DisplayName("counts scoped and global emitters")
        void countsAllEmitters() {
            service.createEmitter("login");
            service.createEmitter(null);

            assertEquals(2, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class ForwardingTests {

        @Test
        @DisplayName("publishing before the response is bound does not throw")
        void publishBeforeBinding() {
            service.createEmitter("login");
            service.createEmitter(null);

            assertDoesNotThrow(() -> {
                eventBus.publish(progress("login", "Writing LoginForm.tsx"));
                eventBus.publish(new AutomakerEvent(AutoModeEvents.IDLE, "/tmp/shop", null,
                        Map.of(), Instant.now()));
            });
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent publishing does not throw")
        void concurrentPublish() throws InterruptedException {
            service.createEmitter("login");

            int threadCount = 5;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(progress("login", "chunk " + threadId + "." + i));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }
}
