package com.warden.guard;

import java.util.concurrent.CancellationException;

/**
 * Read side of a cancellation request, usually tied to the lifetime of the originating HTTP
 * request.
 * <p>
 * Data sources poll {@link #isCancellationRequested()} before doing work and register an
 * {@link #onCancel(Runnable)} callback to abort work already in flight.
 *
 * @see CancellationSource
 */
public interface CancellationSignal {

    /** A signal that is never cancelled. */
    CancellationSignal NONE = new CancellationSignal() {
        @Override
        public boolean isCancellationRequested() {
            return false;
        }

        @Override
        public Registration onCancel(Runnable callback) {
            return () -> { };
        }

        @Override
        public String toString() {
            return "CancellationSignal.NONE";
        }
    };

    /** Returns the never-cancelled signal. */
    static CancellationSignal none() {
        return NONE;
    }

    /** Whether cancellation has been requested. */
    boolean isCancellationRequested();

    /**
     * Registers a callback to run once when cancellation is requested. If cancellation was already
     * requested the callback runs immediately on the calling thread.
     *
     * @param callback the action to run
     * @return a handle that removes the callback when closed
     */
    Registration onCancel(Runnable callback);

    /**
     * Throws if cancellation has been requested.
     *
     * @throws CancellationException if cancelled
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Ownership check cancelled");
        }
    }

    /** Handle for a registered cancellation callback. */
    @FunctionalInterface
    interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
