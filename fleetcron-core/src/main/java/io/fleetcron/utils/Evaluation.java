package io.fleetcron.utils;

import io.fleetcron.core.JobState;
import io.fleetcron.core.SkipReason;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of evaluating one job's trigger at one instant.
 *
 * @param due          the job should be launched now
 * @param nextEligible time the job becomes (or became) due; null when the trigger has no further occurrence
 * @param state        bookkeeping to store back, whether or not the job is launched
 * @param terminal     the trigger is exhausted once this occurrence fires (once jobs)
 * @param skipReason   why a due occurrence is held back or consumed without running; null otherwise
 * @param missedBy     how late the occurrence is being fired
 */
public record Evaluation(
        boolean due,
        Instant nextEligible,
        JobState state,
        boolean terminal,
        SkipReason skipReason,
        Duration missedBy
) {

    static Evaluation notDue(JobState state, Instant nextEligible, SkipReason reason) {
        return new Evaluation(false, nextEligible, state, false, reason, Duration.ZERO);
    }

    static Evaluation due(JobState state, Instant fireAt, boolean terminal, Duration missedBy) {
        return new Evaluation(true, fireAt, state, terminal, null, missedBy);
    }
}
