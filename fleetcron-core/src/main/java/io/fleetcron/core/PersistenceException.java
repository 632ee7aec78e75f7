package io.fleetcron.core;

public class PersistenceException extends FleetcronException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
