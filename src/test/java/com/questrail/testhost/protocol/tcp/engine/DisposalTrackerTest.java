package com.questrail.testhost.protocol.tcp.engine;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class DisposalTrackerTest {

    private final List<Throwable> failures = new ArrayList<>();
    private final DisposalTracker tracker = new DisposalTracker(failures::add);

    @Test
    void actionsRunInReverseRegistrationOrder() {
        List<String> order = new ArrayList<>();
        tracker.addAction(() -> order.add("listener"));
        tracker.addAsyncAction(() -> {
            order.add("quit");
            return CompletableFuture.completedFuture(null);
        });
        tracker.addAction(() -> order.add("socket"));

        tracker.dispose().join();

        assertEquals(List.of("socket", "quit", "listener"), order);
        assertTrue(failures.isEmpty());
    }

    @Test
    void asyncActionCompletesBeforeEarlierActionStarts() {
        List<String> order = new ArrayList<>();
        CompletableFuture<Void> pendingWrite = new CompletableFuture<>();

        tracker.addAction(() -> order.add("close"));
        tracker.addAsyncAction(() -> {
            order.add("write started");
            return pendingWrite;
        });

        CompletableFuture<Void> done = tracker.dispose();

        assertEquals(List.of("write started"), order);
        assertFalse(done.isDone());

        order.add("write finished");
        pendingWrite.complete(null);

        assertTrue(done.isDone());
        assertEquals(List.of("write started", "write finished", "close"), order);
    }

    @Test
    void failingActionsAreReportedAndDoNotStopTheRest() {
        List<String> order = new ArrayList<>();
        tracker.addAction(() -> order.add("first registered"));
        tracker.addAsyncAction(() -> CompletableFuture.failedFuture(new IOException("flush failed")));
        tracker.addAsyncAction(() -> {
            throw new IOException("send failed");
        });
        tracker.addAction(() -> {
            throw new IllegalStateException("close failed");
        });

        CompletableFuture<Void> done = tracker.dispose();

        assertFalse(done.isCompletedExceptionally());
        done.join();
        assertEquals(List.of("first registered"), order);
        assertEquals(3, failures.size());
        assertEquals("close failed", failures.get(0).getMessage());
        assertEquals("send failed", failures.get(1).getMessage());
    }

    @Test
    void secondDisposeIsRejectedAndDoesNotRerunActions() {
        int[] runs = new int[1];
        tracker.addAction(() -> runs[0]++);

        tracker.dispose().join();

        assertThrows(IllegalStateException.class, tracker::dispose);
        assertEquals(1, runs[0]);
    }

    @Test
    void registrationAfterDisposeIsRejected() {
        tracker.dispose().join();

        assertThrows(IllegalStateException.class, () -> tracker.addAction(() -> {}));
        assertThrows(IllegalStateException.class,
                () -> tracker.addAsyncAction(() -> CompletableFuture.completedFuture(null)));
    }
}
