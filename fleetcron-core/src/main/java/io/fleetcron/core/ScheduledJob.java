package io.fleetcron.core;

/**
 * A job definition together with its bookkeeping, as held by the registry and persisted.
 */
public record ScheduledJob(JobSpec spec, JobState state) {

    public ScheduledJob {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        state = state == null ? JobState.fresh() : state;
    }

    public String name() {
        return spec.name();
    }

    public ScheduledJob withSpec(JobSpec spec) {
        return new ScheduledJob(spec, state);
    }

    public ScheduledJob withState(JobState state) {
        return new ScheduledJob(spec, state);
    }
}
