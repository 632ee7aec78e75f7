package io.fleetcron.core;

/**
 * Where running instances are counted for the maxrunning admission check.
 */
public enum RunScope {
    LOCAL,
    CLUSTER
}
