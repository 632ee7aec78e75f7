package io.fleetcron.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of a schedule management call.
 *
 * result   : TRUE applied, FALSE rejected/failed, null "would change" (test mode)
 * comment  : human readable text
 * changes  : job name -> change description (e.g. "added", "removed", "enabled")
 */
public record ScheduleResult(
        Boolean result,
        String comment,
        Map<String, Object> changes
) {

    public ScheduleResult {
        changes = changes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    public static ScheduleResult applied(String comment, Map<String, Object> changes) {
        return new ScheduleResult(Boolean.TRUE, comment, changes);
    }

    public static ScheduleResult applied(String comment) {
        return new ScheduleResult(Boolean.TRUE, comment, Map.of());
    }

    public static ScheduleResult failed(String comment) {
        return new ScheduleResult(Boolean.FALSE, comment, Map.of());
    }

    public static ScheduleResult wouldChange(String comment, Map<String, Object> changes) {
        return new ScheduleResult(null, comment, changes);
    }

    public boolean isFailure() {
        return Boolean.FALSE.equals(result);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }
}
