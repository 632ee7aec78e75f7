package io.fleetcron.core;

/**
 * Base type of every error raised by the scheduler and its collaborators.
 */
public class FleetcronException extends RuntimeException {

    public FleetcronException(String message) {
        super(message);
    }

    public FleetcronException(String message, Throwable cause) {
        super(message, cause);
    }
}
