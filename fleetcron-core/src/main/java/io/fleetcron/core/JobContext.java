package io.fleetcron.core;

import java.time.Instant;
import java.util.Map;

/**
 * Per-execution context handed to a job function instead of ambient thread-local state.
 */
public record JobContext(
        String jobName,
        String jid,
        String nodeId,
        Instant startedAt,
        Map<String, Object> metadata
) {
}
