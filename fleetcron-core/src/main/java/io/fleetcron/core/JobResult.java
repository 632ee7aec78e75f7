package io.fleetcron.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one job execution, published to the event sink.
 */
public record JobResult(
        String jobName,
        String jid,
        String nodeId,
        String function,
        List<Object> args,
        boolean success,
        Object returnValue,
        String error,
        int retcode,
        Instant startedAt,
        Instant finishedAt,
        Map<String, Object> metadata
) {

    public static final int RETCODE_SUCCESS = 0;
    public static final int RETCODE_FAILURE = 254;

    public JobResult {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static JobResult success(RunningJobRecord run, Object returnValue, Instant finishedAt, Map<String, Object> metadata) {
        return new JobResult(run.jobName(), run.jid(), run.nodeId(), run.function(), run.args(), true,
                returnValue, null, RETCODE_SUCCESS, run.startedAt(), finishedAt, metadata);
    }

    public static JobResult failure(RunningJobRecord run, String error, Instant finishedAt, Map<String, Object> metadata) {
        return new JobResult(run.jobName(), run.jid(), run.nodeId(), run.function(), run.args(), false,
                null, error, RETCODE_FAILURE, run.startedAt(), finishedAt, metadata);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
