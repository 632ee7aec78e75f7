package io.fleetcron.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializable view of the whole registry: the global enabled switch plus every job keyed by name.
 */
public record ScheduleSnapshot(boolean enabled, Map<String, ScheduledJob> jobs) {

    public ScheduleSnapshot {
        jobs = jobs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
    }

    public static ScheduleSnapshot empty() {
        return new ScheduleSnapshot(true, Map.of());
    }
}
