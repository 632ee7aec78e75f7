package io.fleetcron.core;

/**
 * Why a job was not launched on a tick. Reported through {@link JobState#lastSkipReason()}.
 */
public enum SkipReason {

    MAXRUNNING("maxrunning"),
    SEMAPHORE("semaphore"),
    SKIP_DURING_RANGE("skip_during_range"),
    OUTSIDE_RANGE("in_skip_range"),
    SKIP_EXPLICIT("skip_explicit"),
    CLOCK_SKEW("clock_skew"),
    UNTIL_PASSED("until"),
    BEFORE_AFTER("after"),
    SHUTTING_DOWN("shutting_down");

    private final String value;

    SkipReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
