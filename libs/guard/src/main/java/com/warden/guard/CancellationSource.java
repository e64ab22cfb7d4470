package com.warden.guard;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner side of a {@link CancellationSignal}. One source is created per request; calling
 * {@link #cancel()} fires every registered callback exactly once.
 */
public final class CancellationSource implements CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSource.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    @Override
    public Registration onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback must not be null");
        }
        Callback entry = new Callback(callback);
        callbacks.add(entry);
        if (cancelled.get()) {
            fire(entry);
            return () -> { };
        }
        return () -> callbacks.remove(entry);
    }

    /**
     * Requests cancellation. Idempotent: only the first call fires callbacks.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Callback entry : callbacks) {
            fire(entry);
        }
    }

    // Removal claims the callback, so a callback racing with cancel() still runs once.
    private void fire(Callback entry) {
        if (!callbacks.remove(entry)) {
            return;
        }
        try {
            entry.action().run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    // Identity equality, so the same Runnable registered twice yields two callbacks.
    private static final class Callback {

        private final Runnable action;

        private Callback(Runnable action) {
            this.action = action;
        }

        private Runnable action() {
            return action;
        }
    }
}
