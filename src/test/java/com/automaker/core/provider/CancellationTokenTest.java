package com.automaker.core.provider;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelRunsListenersOnce() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void listenerAddedAfterCancelRunsImmediately() {
        var token = new CancellationToken();
        token.cancel();
        var calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(() -> { throw new IllegalStateException("boom"); });
        token.onCancel(calls::incrementAndGet);

        assertDoesNotThrow(token::cancel);
        assertEquals(1, calls.get());
    }
}
