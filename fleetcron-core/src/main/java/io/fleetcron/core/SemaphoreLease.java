package io.fleetcron.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A slot requested from (and possibly granted by) the concurrency coordinator.
 *
 * <p>The authoritative copy is the ephemeral node at {@link #nodePath()}; this object is the
 * local view and must be treated as {@link LeaseState#LOST} once the session behind it is gone.
 */
public final class SemaphoreLease {

    private final String resourceName;
    private final String identifier;
    private final String nodePath;
    private final long sequenceNumber;
    private volatile Instant acquiredAt;
    private volatile LeaseState state = LeaseState.REQUESTED;

    public SemaphoreLease(String resourceName, String identifier, String nodePath, long sequenceNumber) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName must not be null");
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.nodePath = Objects.requireNonNull(nodePath, "nodePath must not be null");
        this.sequenceNumber = sequenceNumber;
    }

    public String resourceName() {
        return resourceName;
    }

    public String identifier() {
        return identifier;
    }

    public String nodePath() {
        return nodePath;
    }

    public long sequenceNumber() {
        return sequenceNumber;
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    public LeaseState state() {
        return state;
    }

    public boolean isGranted() {
        return state == LeaseState.GRANTED;
    }

    public synchronized void grant(Instant at) {
        if (state != LeaseState.REQUESTED) {
            throw new IllegalStateException("lease " + nodePath + " cannot be granted from " + state);
        }
        this.acquiredAt = at;
        this.state = LeaseState.GRANTED;
    }

    public synchronized void release() {
        if (!state.isTerminal()) {
            this.state = LeaseState.RELEASED;
        }
    }

    /**
     * Marks the lease lost; returns true when this call changed the state.
     */
    public synchronized boolean lose() {
        if (state.isTerminal()) {
            return false;
        }
        this.state = LeaseState.LOST;
        return true;
    }

    @Override
    public String toString() {
        return "SemaphoreLease{resource=" + resourceName + ", identifier=" + identifier
                + ", seq=" + sequenceNumber + ", state=" + state + "}";
    }
}
