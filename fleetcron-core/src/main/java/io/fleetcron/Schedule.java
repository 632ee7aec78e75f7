package io.fleetcron;

import io.fleetcron.core.JobSpec;
import io.fleetcron.core.ScheduleResult;
import io.fleetcron.core.ScheduledJob;
import io.fleetcron.spi.ScheduleSource;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Main scheduler API: lifecycle plus the management surface.
 *
 * <p>Every mutating call returns a {@link ScheduleResult}. With {@code test = true} the call is
 * validated and reports the change it would make ({@code result == null}) without touching state.
 *
 * <pre>{@code
 * schedule.start();
 * schedule.add(JobSpec.builder("ping").function("test.ping").seconds(30).build(), false);
 * schedule.disable("ping", false);
 * schedule.stop();
 * }</pre>
 */
public interface Schedule {
    void start();

    void stop();

    boolean isRunning();

    ScheduleResult add(JobSpec spec, boolean test);

    default ScheduleResult add(JobSpec spec) {
        return add(spec, false);
    }

    /**
     * Replaces an existing job's definition, keeping its run bookkeeping.
     */
    ScheduleResult modify(JobSpec spec, boolean test);

    ScheduleResult delete(String name, boolean test);

    ScheduleResult enable(String name, boolean test);

    ScheduleResult disable(String name, boolean test);

    /**
     * Deletes every job.
     */
    ScheduleResult purge(boolean test);

    /**
     * Diffs the registry against {@code source}: adds new jobs, removes missing ones and replaces the
     * rest while keeping their bookkeeping.
     */
    ScheduleResult reload(ScheduleSource source, boolean test);

    Map<String, ScheduledJob> list(boolean showDisabled);

    Optional<ScheduledJob> get(String name);

    /**
     * Fires a job now, outside its trigger. {@code force} also runs disabled jobs.
     */
    ScheduleResult runJob(String name, boolean force);

    /**
     * Skips the occurrence at {@code currentTime} and runs the job at {@code newTime} instead.
     */
    ScheduleResult postponeJob(String name, Instant currentTime, Instant newTime, boolean test);

    ScheduleResult skipJob(String name, Instant time, boolean test);

    Optional<Instant> nextFireTime(String name);

    /**
     * Global switch: while disabled no job fires.
     */
    ScheduleResult enableSchedule(boolean test);

    ScheduleResult disableSchedule(boolean test);

    boolean isEnabled(String name);

    /**
     * Forces the registry to durable storage.
     */
    ScheduleResult save();
}
