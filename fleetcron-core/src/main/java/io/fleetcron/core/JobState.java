package io.fleetcron.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-job bookkeeping maintained by the scheduler loop and persisted with the job spec.
 *
 * <ul>
 *   <li>lastRun: start of the last consumed occurrence (fired or explicitly skipped)</li>
 *   <li>runCount: number of launches</li>
 *   <li>nextFireTime: next occurrence as last computed by the evaluator</li>
 *   <li>splayUntil: splay-delayed fire time of the current due-cycle, null outside a cycle</li>
 *   <li>anchor: first time the job was evaluated; base for triggers that never fired</li>
 *   <li>skipExplicit / runExplicit: one-off skip and run times (skip_job / postpone_job)</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobState(
        Instant lastRun,
        long runCount,
        Instant nextFireTime,
        Instant splayUntil,
        Instant anchor,
        SkipReason lastSkipReason,
        List<Instant> skipExplicit,
        List<Instant> runExplicit
) {

    public JobState {
        skipExplicit = skipExplicit == null ? List.of() : List.copyOf(skipExplicit);
        runExplicit = runExplicit == null ? List.of() : List.copyOf(runExplicit);
    }

    public static JobState fresh() {
        return new JobState(null, 0, null, null, null, null, List.of(), List.of());
    }

    public JobState withAnchor(Instant anchor) {
        return new JobState(lastRun, runCount, nextFireTime, splayUntil, anchor, lastSkipReason, skipExplicit, runExplicit);
    }

    public JobState withNextFireTime(Instant nextFireTime) {
        return new JobState(lastRun, runCount, nextFireTime, splayUntil, anchor, lastSkipReason, skipExplicit, runExplicit);
    }

    public JobState withSplayUntil(Instant splayUntil) {
        return new JobState(lastRun, runCount, nextFireTime, splayUntil, anchor, lastSkipReason, skipExplicit, runExplicit);
    }

    public JobState withSkipReason(SkipReason reason) {
        return new JobState(lastRun, runCount, nextFireTime, splayUntil, anchor, reason, skipExplicit, runExplicit);
    }

    public JobState withSkipExplicit(List<Instant> skipExplicit) {
        return new JobState(lastRun, runCount, nextFireTime, splayUntil, anchor, lastSkipReason, skipExplicit, runExplicit);
    }

    public JobState withRunExplicit(List<Instant> runExplicit) {
        return new JobState(lastRun, runCount, nextFireTime, splayUntil, anchor, lastSkipReason, skipExplicit, runExplicit);
    }

    /**
     * Bookkeeping after a launch at {@code firedAt}.
     */
    public JobState fired(Instant firedAt) {
        return new JobState(firedAt, runCount + 1, null, null, anchor, null, skipExplicit, runExplicit);
    }

    /**
     * Bookkeeping after an occurrence was consumed without running.
     */
    public JobState consumed(Instant at, SkipReason reason) {
        return new JobState(at, runCount, null, null, anchor, reason, skipExplicit, runExplicit);
    }

    public JobState addSkipExplicit(Instant time) {
        List<Instant> copy = new ArrayList<>(skipExplicit);
        if (!copy.contains(time)) {
            copy.add(time);
            copy.sort(null);
        }
        return withSkipExplicit(copy);
    }

    public JobState addRunExplicit(Instant time) {
        List<Instant> copy = new ArrayList<>(runExplicit);
        if (!copy.contains(time)) {
            copy.add(time);
            copy.sort(null);
        }
        return withRunExplicit(copy);
    }

    /**
     * Keeps the trigger-relevant bookkeeping of {@code previous}; used when a spec is replaced.
     */
    public static JobState carryOver(JobState previous) {
        if (previous == null) {
            return fresh();
        }
        return new JobState(previous.lastRun, previous.runCount, previous.nextFireTime, null, previous.anchor,
                previous.lastSkipReason, previous.skipExplicit, previous.runExplicit);
    }
}
