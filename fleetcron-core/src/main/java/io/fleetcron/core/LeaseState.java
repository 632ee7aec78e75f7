package io.fleetcron.core;

/**
 * Lifecycle of a {@link SemaphoreLease}: REQUESTED -> GRANTED -> RELEASED, or LOST on session expiry.
 * LOST and RELEASED are terminal; a new lock call is needed to try again.
 */
public enum LeaseState {
    REQUESTED,
    GRANTED,
    RELEASED,
    LOST;

    public boolean isTerminal() {
        return this == RELEASED || this == LOST;
    }
}
