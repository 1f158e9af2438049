package com.designsync.engine.service;

import com.designsync.engine.exception.PipelineCancelledException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cooperative cancellation flag. Traversals check it between node visits;
 * futures registered with {@link #link(CompletableFuture)} are cancelled when it fires.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<CompletableFuture<?>> inFlight = new CopyOnWriteArrayList<>();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (CompletableFuture<?> future : inFlight) {
                future.cancel(true);
            }
            inFlight.clear();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new PipelineCancelledException("Pipeline cancelled by caller");
        }
    }

    /**
     * Ties a pending future to this signal. Returns the same future.
     */
    public <T> CompletableFuture<T> link(CompletableFuture<T> future) {
        if (cancelled.get()) {
            future.cancel(true);
            return future;
        }
        inFlight.add(future);
        future.whenComplete((result, error) -> inFlight.remove(future));
        if (cancelled.get()) {
            future.cancel(true);
        }
        return future;
    }
}
