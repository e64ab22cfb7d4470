package com.warden.guard.web;

import com.warden.guard.Disposition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for ownership decisions taken by the web layer.
 * <p>
 * Both meters carry a {@code resource} tag (simple name of the resource type) and an
 * {@code outcome} tag: the lower-cased {@link Disposition}, or one of {@link #OUTCOME_TIMEOUT},
 * {@link #OUTCOME_UNREGISTERED} and {@link #OUTCOME_ERROR}.
 */
public class OwnershipDecisionMetrics {

    /** Counter of decisions. */
    public static final String DECISIONS = "warden.ownership.decisions";

    /** Timer of the time spent waiting for a decision. */
    public static final String DURATION = "warden.ownership.decision.duration";

    public static final String TAG_RESOURCE = "resource";
    public static final String TAG_OUTCOME = "outcome";

    public static final String OUTCOME_TIMEOUT = "timeout";
    public static final String OUTCOME_UNREGISTERED = "unregistered";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public OwnershipDecisionMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Records a completed decision. */
    public void record(Class<?> resourceType, Disposition disposition, long durationNanos) {
        record(resourceType, disposition.name().toLowerCase(Locale.ROOT), durationNanos);
    }

    /** Records a decision that ended with the given outcome label. */
    public void record(Class<?> resourceType, String outcome, long durationNanos) {
        String resource = resourceType.getSimpleName();
        Counter.builder(DECISIONS)
                .description("Ownership decisions by resource type and outcome")
                .tags(TAG_RESOURCE, resource, TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Time spent deciding ownership")
                .tags(TAG_RESOURCE, resource, TAG_OUTCOME, outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public MeterRegistry registry() {
        return registry;
    }
}
