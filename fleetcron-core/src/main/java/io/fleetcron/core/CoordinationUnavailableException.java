package io.fleetcron.core;

/**
 * The coordination service cannot be reached or the session backing a call is gone.
 */
public class CoordinationUnavailableException extends FleetcronException {

    public CoordinationUnavailableException(String message) {
        super(message);
    }

    public CoordinationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
