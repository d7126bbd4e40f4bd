package com.irledger.application.service;

import com.irledger.application.port.out.ListenerRegistration;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.function.Consumer;

/**
 * Cancellation handle of a live change feed subscription.
 * Cancelling stops further deliveries and releases the store listener; it is idempotent.
 *
 * <p>A subscription may be re-bound to a new store listener when the feed
 * switches to its fallback path. Each binding gets a generation number and
 * deliveries from stale generations are dropped.
 */
public final class Subscription implements AutoCloseable {

    private final Handler<List<JsonObject>> callback;
    private final Consumer<Subscription> onCancel;
    private ListenerRegistration registration;
    private long generation;
    private boolean cancelled;

    Subscription(Handler<List<JsonObject>> callback, Consumer<Subscription> onCancel) {
        this.callback = callback;
        this.onCancel = onCancel;
    }

    public void cancel() {
        ListenerRegistration current;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            current = registration;
            registration = null;
        }
        if (current != null) {
            current.remove();
        }
        onCancel.accept(this);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void close() {
        cancel();
    }

    /**
     * Start a new binding, releasing the current listener
     */
    long nextGeneration() {
        ListenerRegistration previous;
        long next;
        synchronized (this) {
            previous = registration;
            registration = null;
            next = ++generation;
        }
        if (previous != null) {
            previous.remove();
        }
        return next;
    }

    void bind(long bindingGeneration, ListenerRegistration listener) {
        boolean stale;
        synchronized (this) {
            stale = cancelled || bindingGeneration != generation;
            if (!stale) {
                registration = listener;
            }
        }
        if (stale) {
            listener.remove();
        }
    }

    void deliver(long bindingGeneration, List<JsonObject> rows) {
        synchronized (this) {
            if (cancelled || bindingGeneration != generation) {
                return;
            }
        }
        callback.handle(rows);
    }
}
