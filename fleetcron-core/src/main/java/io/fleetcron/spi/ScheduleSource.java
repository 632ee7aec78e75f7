package io.fleetcron.spi;

import io.fleetcron.core.JobSpec;

import java.util.Map;

/**
 * External configuration the registry can be reloaded from.
 */
public interface ScheduleSource {

    /**
     * @return job specs keyed by job name
     * @throws io.fleetcron.core.ConfigException when an entry is malformed
     */
    Map<String, JobSpec> load();
}
