package com.warden.guard;

import java.util.List;

/**
 * The single lookup a decision performs: select the resource matching {@code filter}, then
 * project the logical AND of {@code conditions}.
 * <p>
 * Data sources only ever receive this closed shape (one equality filter, a conjunction of
 * equality conditions), so they can evaluate it in-process or translate it into one query.
 *
 * @param filter     identifier equality selecting the resource
 * @param conditions owner (and tenant) equalities that must all hold
 * @param <T>        resource type
 */
public record OwnershipProbe<T>(FieldMatch<T> filter, List<FieldMatch<T>> conditions) {

    public OwnershipProbe {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("conditions must contain at least one condition");
        }
        conditions = List.copyOf(conditions);
    }

    /** Returns true if the resource is the one this probe selects. */
    public boolean selects(T resource) {
        return filter.test(resource);
    }

    /** Evaluates the conjunction of conditions against a selected resource. */
    public ProbeOutcome evaluate(T resource) {
        for (FieldMatch<T> condition : conditions) {
            if (!condition.test(resource)) {
                return ProbeOutcome.MISMATCHED;
            }
        }
        return ProbeOutcome.MATCHED;
    }
}
