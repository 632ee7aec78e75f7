package io.fleetcron.spi;

public enum SessionState {
    CONNECTED,
    SUSPENDED,
    RECONNECTED,
    LOST
}
