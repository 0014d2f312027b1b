package com.questrail.testhost.protocol.tcp.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * DisposalTracker
 * =============================================================================
 * Ordered stack of cleanup actions, registered as resources are acquired and
 * released in strict reverse order exactly once.
 *
 * <h2>Isolation</h2>
 * Each action runs on its own: a synchronous action that throws, or an
 * asynchronous one whose stage fails, is reported to the failure observer and
 * the next action still runs.
 *
 * <h2>Sequencing</h2>
 * An asynchronous action's stage must complete before the next (earlier
 * registered) action starts. Actions after an asynchronous one may therefore
 * run on whichever thread completes that stage.
 *
 * <h2>Thread Safety</h2>
 * Registration and {@link #dispose()} may be called from different threads.
 * Registration after disposal has begun is rejected.
 */
public final class DisposalTracker
{
    /**
     * A cleanup action that finishes asynchronously.
     */
    @FunctionalInterface
    public interface AsyncAction {
        CompletionStage<?> run() throws Exception;
    }

    private final Deque<AsyncAction> actions = new ArrayDeque<>();
    private final Consumer<Throwable> failureObserver;
    private boolean disposed;

    /**
     * @param failureObserver receives failures escaping individual actions
     */
    public DisposalTracker(Consumer<Throwable> failureObserver) {
        this.failureObserver = Objects.requireNonNull(failureObserver, "failureObserver");
    }

    /**
     * @throws IllegalStateException if disposal has already begun
     */
    public void addAction(Runnable action) {
        Objects.requireNonNull(action, "action");
        addAsyncAction(() -> {
            action.run();
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * @throws IllegalStateException if disposal has already begun
     */
    public synchronized void addAsyncAction(AsyncAction action) {
        Objects.requireNonNull(action, "action");
        if (disposed) {
            throw new IllegalStateException("DisposalTracker has already been disposed");
        }
        actions.push(action);
    }

    /**
     * Run every registered action, most recently registered first.
     *
     * @return completes once the last action has finished; never completes exceptionally
     * @throws IllegalStateException if called more than once
     */
    public CompletableFuture<Void> dispose() {
        List<AsyncAction> snapshot;
        synchronized (this) {
            if (disposed) {
                throw new IllegalStateException("DisposalTracker has already been disposed");
            }
            disposed = true;
            snapshot = new ArrayList<>(actions);
            actions.clear();
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (AsyncAction action : snapshot) {
            chain = chain.thenCompose(ignored -> runIsolated(action));
        }
        return chain;
    }

    private CompletableFuture<Void> runIsolated(AsyncAction action) {
        CompletionStage<?> stage;
        try {
            stage = action.run();
        } catch (Exception e) {
            failureObserver.accept(e);
            return CompletableFuture.completedFuture(null);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }

        return stage.toCompletableFuture().handle((result, failure) -> {
            if (failure != null) {
                failureObserver.accept(failure);
            }
            return null;
        });
    }
}
