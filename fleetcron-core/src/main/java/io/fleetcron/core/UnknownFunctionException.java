package io.fleetcron.core;

public class UnknownFunctionException extends FleetcronException {

    public UnknownFunctionException(String functionId) {
        super("No JobFunction registered for id: " + functionId);
    }
}
