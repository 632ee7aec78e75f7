package io.fleetcron.core;

/**
 * Cluster-wide slot a job must hold while it runs.
 */
public record SemaphoreSpec(String resource, int maxConcurrent) {

    public SemaphoreSpec {
        if (resource == null || resource.isBlank()) {
            throw new ConfigException(null, "semaphore resource must not be blank");
        }
        if (maxConcurrent < 1) {
            throw new ConfigException(null, "semaphore maxConcurrent must be >= 1");
        }
    }
}
