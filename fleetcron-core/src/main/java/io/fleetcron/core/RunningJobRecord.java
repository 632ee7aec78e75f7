package io.fleetcron.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One in-flight execution, as tracked locally or reported by a peer.
 *
 * @param jid      run identifier, unique per launch
 * @param jobName  schedule entry that launched it
 * @param nodeId   node that runs it
 * @param pid      OS process id of the runner
 * @param function function id being invoked
 * @param args     positional arguments
 */
public record RunningJobRecord(
        String jid,
        String jobName,
        String nodeId,
        long pid,
        Instant startedAt,
        String function,
        List<Object> args
) {
    public RunningJobRecord {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }
}
