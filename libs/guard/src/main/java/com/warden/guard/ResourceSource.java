package com.warden.guard;

import java.util.concurrent.CompletableFuture;

/**
 * Backing data source the guard probes for one resource type.
 * <p>
 * Implementations fetch at most one match for the probe's filter and must honour the
 * cancellation signal: complete the future with a {@link java.util.concurrent.CancellationException}
 * rather than blocking past cancellation. Store faults complete the future exceptionally and are
 * never retried by the guard.
 *
 * @param <T> resource type
 */
@FunctionalInterface
public interface ResourceSource<T> {

    /**
     * Runs the probe.
     *
     * @param probe  identifier filter plus ownership conditions
     * @param signal cancellation signal tied to the originating request
     * @return a future completing with {@link ProbeOutcome#ABSENT}, {@link ProbeOutcome#MATCHED}
     *         or {@link ProbeOutcome#MISMATCHED}
     */
    CompletableFuture<ProbeOutcome> probe(OwnershipProbe<T> probe, CancellationSignal signal);
}
