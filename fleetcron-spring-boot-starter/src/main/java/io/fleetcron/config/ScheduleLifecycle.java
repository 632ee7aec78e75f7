package io.fleetcron.config;

import io.fleetcron.Schedule;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges the scheduler's start/stop with the Spring container lifecycle.
 *
 * <p>Running state is the schedule's own, so a schedule that stopped itself (for example after
 * repeated tick failures) is reported as stopped and started again on the next context start.
 */
public class ScheduleLifecycle implements SmartLifecycle {
    private final Schedule schedule;

    public ScheduleLifecycle(Schedule schedule) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
    }

    @Override
    public void start() {
        schedule.start();
    }

    @Override
    public void stop() {
        schedule.stop();
    }

    @Override
    public boolean isRunning() {
        return schedule.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
