package io.fleetcron.spi;

@FunctionalInterface
public interface SessionListener {

    void stateChanged(SessionState state);
}
