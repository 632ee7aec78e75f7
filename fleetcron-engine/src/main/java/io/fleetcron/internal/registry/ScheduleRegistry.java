package io.fleetcron.internal.registry;

import io.fleetcron.core.JobSpec;
import io.fleetcron.core.JobState;
import io.fleetcron.core.PersistenceException;
import io.fleetcron.core.ScheduleResult;
import io.fleetcron.core.ScheduleSnapshot;
import io.fleetcron.core.ScheduledJob;
import io.fleetcron.spi.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative set of job specs and their bookkeeping.
 *
 * <p>Every mutation that changes what a crash-restart would decide is written through the
 * {@link ScheduleStore} while the write lock is held, so stored snapshots are applied in order.
 * A failed write is logged and leaves the registry dirty; the next mutation (or {@link #save()})
 * writes the full snapshot again.
 */
public class ScheduleRegistry {
    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistry.class);

    private final ScheduleStore store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private boolean scheduleEnabled = true;
    private boolean dirty;

    public ScheduleRegistry(ScheduleStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Replaces the in-memory registry with the stored snapshot. Unreadable storage leaves the
     * registry empty.
     */
    public void load() {
        ScheduleSnapshot snapshot;
        try {
            snapshot = store.load();
        } catch (PersistenceException ex) {
            log.error("Failed to load schedule, starting with an empty registry msg={}", ex.getMessage(), ex);
            snapshot = ScheduleSnapshot.empty();
        }
        lock.writeLock().lock();
        try {
            jobs.clear();
            jobs.putAll(snapshot.jobs());
            scheduleEnabled = snapshot.enabled();
            dirty = false;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Schedule loaded jobs={} enabled={}", snapshot.jobs().size(), snapshot.enabled());
    }

    public ScheduleSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new ScheduleSnapshot(scheduleEnabled, jobs);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isScheduleEnabled() {
        lock.readLock().lock();
        try {
            return scheduleEnabled;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDirty() {
        lock.readLock().lock();
        try {
            return dirty;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ScheduledJob> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, ScheduledJob> list(boolean showDisabled) {
        lock.readLock().lock();
        try {
            Map<String, ScheduledJob> out = new LinkedHashMap<>();
            jobs.forEach((name, job) -> {
                if (showDisabled || job.spec().enabled()) {
                    out.put(name, job);
                }
            });
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ScheduleResult add(JobSpec spec, boolean test) {
        Objects.requireNonNull(spec, "spec must not be null");
        String name = spec.name();
        lock.writeLock().lock();
        try {
            if (jobs.containsKey(name)) {
                return ScheduleResult.failed("Job " + name + " already exists in schedule.");
            }
            if (test) {
                return ScheduleResult.wouldChange("Job: " + name + " would be added to schedule.", Map.of(name, "added"));
            }
            jobs.put(name, new ScheduledJob(spec, JobState.fresh()));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Added job={} function={} trigger={}", name, spec.function(), spec.trigger().type());
        return ScheduleResult.applied("Added job: " + name + " to schedule.", Map.of(name, "added"));
    }

    public ScheduleResult modify(JobSpec spec, boolean test) {
        Objects.requireNonNull(spec, "spec must not be null");
        String name = spec.name();
        lock.writeLock().lock();
        try {
            ScheduledJob existing = jobs.get(name);
            if (existing == null) {
                return ScheduleResult.failed("Job " + name + " does not exist in schedule.");
            }
            if (existing.spec().equals(spec)) {
                return ScheduleResult.applied("Job " + name + " in correct state");
            }
            if (test) {
                return ScheduleResult.wouldChange("Job: " + name + " would be modified in schedule.", Map.of(name, "modified"));
            }
            jobs.put(name, new ScheduledJob(spec, JobState.carryOver(existing.state())));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Modified job={}", name);
        return ScheduleResult.applied("Modified job: " + name + " in schedule.", Map.of(name, "modified"));
    }

    public ScheduleResult delete(String name, boolean test) {
        lock.writeLock().lock();
        try {
            if (!jobs.containsKey(name)) {
                return ScheduleResult.failed("Job " + name + " does not exist.");
            }
            if (test) {
                return ScheduleResult.wouldChange("Job: " + name + " would be deleted from schedule.", Map.of(name, "removed"));
            }
            jobs.remove(name);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted job={}", name);
        return ScheduleResult.applied("Deleted Job " + name + " from schedule.", Map.of(name, "removed"));
    }

    /**
     * Deletes every job whose name starts with {@code prefix}; an empty prefix purges the registry.
     */
    public ScheduleResult deleteByPrefix(String prefix, boolean test) {
        String p = prefix == null ? "" : prefix;
        lock.writeLock().lock();
        Map<String, Object> changes = new LinkedHashMap<>();
        try {
            for (String name : jobs.keySet()) {
                if (name.startsWith(p)) {
                    changes.put(name, "removed");
                }
            }
            if (test) {
                return ScheduleResult.wouldChange(changes.size() + " job(s) would be deleted from schedule.", changes);
            }
            if (!changes.isEmpty()) {
                jobs.keySet().removeAll(changes.keySet());
                persist();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Purged jobs count={} prefix='{}'", changes.size(), p);
        return ScheduleResult.applied("Deleted " + changes.size() + " job(s) from schedule.", changes);
    }

    public ScheduleResult enable(String name, boolean test) {
        return setEnabled(name, true, test);
    }

    public ScheduleResult disable(String name, boolean test) {
        return setEnabled(name, false, test);
    }

    private ScheduleResult setEnabled(String name, boolean enabled, boolean test) {
        String verb = enabled ? "enabled" : "disabled";
        lock.writeLock().lock();
        try {
            ScheduledJob existing = jobs.get(name);
            if (existing == null) {
                return ScheduleResult.failed("Job " + name + " does not exist.");
            }
            if (existing.spec().enabled() == enabled) {
                return ScheduleResult.applied("Job " + name + " is already " + verb + ".");
            }
            if (test) {
                return ScheduleResult.wouldChange("Job: " + name + " would be " + verb + " in schedule.", Map.of(name, verb));
            }
            jobs.put(name, existing.withSpec(existing.spec().withEnabled(enabled)));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Job {} job={}", verb, name);
        String comment = (enabled ? "Enabled" : "Disabled") + " Job " + name + " in schedule.";
        return ScheduleResult.applied(comment, Map.of(name, verb));
    }

    public ScheduleResult enableSchedule(boolean test) {
        return setScheduleEnabled(true, test);
    }

    public ScheduleResult disableSchedule(boolean test) {
        return setScheduleEnabled(false, test);
    }

    private ScheduleResult setScheduleEnabled(boolean enabled, boolean test) {
        String verb = enabled ? "enabled" : "disabled";
        lock.writeLock().lock();
        try {
            if (scheduleEnabled == enabled) {
                return ScheduleResult.applied("Schedule is already " + verb + ".");
            }
            if (test) {
                return ScheduleResult.wouldChange("Schedule would be " + verb + ".", Map.of("schedule", verb));
            }
            scheduleEnabled = enabled;
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Schedule {}", verb);
        return ScheduleResult.applied((enabled ? "Enabled" : "Disabled") + " schedule.", Map.of("schedule", verb));
    }

    /**
     * Makes the registry match {@code specs}: unknown names are added with fresh bookkeeping,
     * missing names removed, and names present in both take the new spec while keeping their
     * run history.
     */
    public ScheduleResult reload(Map<String, JobSpec> specs, boolean test) {
        Objects.requireNonNull(specs, "specs must not be null");
        Map<String, Object> changes = new LinkedHashMap<>();
        lock.writeLock().lock();
        try {
            Map<String, ScheduledJob> next = new LinkedHashMap<>();
            for (Map.Entry<String, JobSpec> e : specs.entrySet()) {
                String name = e.getKey();
                JobSpec spec = e.getValue().name().equals(name) ? e.getValue() : e.getValue().withName(name);
                ScheduledJob existing = jobs.get(name);
                if (existing == null) {
                    next.put(name, new ScheduledJob(spec, JobState.fresh()));
                    changes.put(name, "added");
                } else if (existing.spec().equals(spec)) {
                    next.put(name, existing);
                } else {
                    next.put(name, new ScheduledJob(spec, JobState.carryOver(existing.state())));
                    changes.put(name, "modified");
                }
            }
            for (String name : jobs.keySet()) {
                if (!next.containsKey(name)) {
                    changes.put(name, "removed");
                }
            }
            if (test) {
                return ScheduleResult.wouldChange("Schedule would be reloaded.", changes);
            }
            jobs.clear();
            jobs.putAll(next);
            if (!changes.isEmpty()) {
                persist();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Schedule reloaded jobs={} changes={}", specs.size(), changes);
        return ScheduleResult.applied("Reloaded schedule.", changes);
    }

    /**
     * Skips the occurrence at {@code currentTime} and adds an explicit run at {@code newTime}.
     */
    public ScheduleResult postpone(String name, Instant currentTime, Instant newTime, boolean test) {
        if (currentTime == null || newTime == null) {
            return ScheduleResult.failed("Job " + name + " postpone requires both the current and the new time.");
        }
        lock.writeLock().lock();
        try {
            ScheduledJob existing = jobs.get(name);
            if (existing == null) {
                return ScheduleResult.failed("Job " + name + " does not exist.");
            }
            if (test) {
                return ScheduleResult.wouldChange("Job: " + name + " would be postponed in schedule.", Map.of(name, "postponed"));
            }
            JobState state = existing.state().addSkipExplicit(currentTime).addRunExplicit(newTime);
            jobs.put(name, existing.withState(state));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Postponed job={} from={} to={}", name, currentTime, newTime);
        return ScheduleResult.applied("Postponed Job " + name + " in schedule.", Map.of(name, "postponed"));
    }

    public ScheduleResult skip(String name, Instant time, boolean test) {
        if (time == null) {
            return ScheduleResult.failed("Job " + name + " skip requires a time.");
        }
        lock.writeLock().lock();
        try {
            ScheduledJob existing = jobs.get(name);
            if (existing == null) {
                return ScheduleResult.failed("Job " + name + " does not exist.");
            }
            if (test) {
                return ScheduleResult.wouldChange("Job: " + name + " would be skipped in schedule.", Map.of(name, "skipped"));
            }
            jobs.put(name, existing.withState(existing.state().addSkipExplicit(time)));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Added skip job={} time={}", name, time);
        return ScheduleResult.applied("Added Skip Job " + name + " in schedule.", Map.of(name, "skipped"));
    }

    /**
     * Records a launch: the evaluated state advanced to {@code firedAt}. A terminal launch
     * disables the job so it stays listed with its history.
     *
     * @param base      the state the evaluation started from
     * @param evaluated the evaluator's output for {@code base}
     */
    public void recordFire(String name, JobState base, JobState evaluated, Instant firedAt, boolean terminal) {
        lock.writeLock().lock();
        try {
            ScheduledJob existing = jobs.get(name);
            if (existing == null) {
                return;
            }
            JobSpec spec = terminal ? existing.spec().withEnabled(false) : existing.spec();
            jobs.put(name, new ScheduledJob(spec, merge(existing.state(), base, evaluated.fired(firedAt))));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        if (terminal) {
            log.info("One-shot job={} fired and was disabled", name);
        }
    }

    /**
     * Stores evaluator output. Only changes that affect future decisions are written through;
     * the cached next fire time and skip reason are kept in memory.
     *
     * @param base      the state the evaluation started from
     * @param evaluated the evaluator's output for {@code base}
     */
    public void updateState(String name, JobState base, JobState evaluated) {
        lock.writeLock().lock();
        try {
            ScheduledJob existing = jobs.get(name);
            if (existing == null) {
                return;
            }
            JobState merged = merge(existing.state(), base, evaluated);
            if (existing.state().equals(merged)) {
                return;
            }
            jobs.put(name, existing.withState(merged));
            if (!decisive(existing.state()).equals(decisive(merged))) {
                persist();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies what the evaluator changed between {@code base} and {@code evaluated} on top of
     * {@code current}. Explicit skip and run times are removed only when the evaluator consumed
     * them, so entries added since {@code base} was read survive.
     */
    static JobState merge(JobState current, JobState base, JobState evaluated) {
        return new JobState(
                evaluated.lastRun(),
                evaluated.runCount(),
                evaluated.nextFireTime(),
                evaluated.splayUntil(),
                evaluated.anchor(),
                evaluated.lastSkipReason(),
                withoutConsumed(current.skipExplicit(), base.skipExplicit(), evaluated.skipExplicit()),
                withoutConsumed(current.runExplicit(), base.runExplicit(), evaluated.runExplicit()));
    }

    private static List<Instant> withoutConsumed(List<Instant> current, List<Instant> base, List<Instant> evaluated) {
        List<Instant> out = new ArrayList<>(current);
        for (Instant t : base) {
            if (!evaluated.contains(t)) {
                out.remove(t);
            }
        }
        return out;
    }

    public ScheduleResult save() {
        lock.writeLock().lock();
        try {
            dirty = true;
            if (persist()) {
                return ScheduleResult.applied("Schedule saved.");
            }
            return ScheduleResult.failed("Failed to save schedule.");
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static JobState decisive(JobState state) {
        return state.withNextFireTime(null).withSkipReason(null);
    }

    // caller holds the write lock
    private boolean persist() {
        dirty = true;
        try {
            store.save(new ScheduleSnapshot(scheduleEnabled, new LinkedHashMap<>(jobs)));
            dirty = false;
            return true;
        } catch (PersistenceException ex) {
            log.error("Failed to persist schedule, will retry on next change msg={}", ex.getMessage(), ex);
            return false;
        }
    }
}
