package com.warden.guard;

/**
 * Tri-state result of an {@link OwnershipProbe}: existence and ownership collapsed into one
 * lookup.
 */
public enum ProbeOutcome {

    /** No resource matched the identifier filter. */
    ABSENT,

    /** A resource matched and every ownership condition held. */
    MATCHED,

    /** A resource matched but at least one ownership condition failed. */
    MISMATCHED;

    /**
     * Maps a boolean condition result onto an existing resource.
     *
     * @param allConditionsHold whether the owner (and tenant) conditions held
     * @return {@link #MATCHED} or {@link #MISMATCHED}
     */
    public static ProbeOutcome of(boolean allConditionsHold) {
        return allConditionsHold ? MATCHED : MISMATCHED;
    }
}
