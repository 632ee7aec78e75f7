package io.fleetcron.spi;

import io.fleetcron.core.JobResult;

/**
 * Fire-and-forget consumer of job completions. Implementations must not block for long;
 * exceptions are logged by the caller and otherwise ignored.
 */
public interface EventSink {

    void publish(JobResult result);
}
