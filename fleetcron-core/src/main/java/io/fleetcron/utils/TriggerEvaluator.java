package io.fleetcron.utils;

import io.fleetcron.core.JobSpec;
import io.fleetcron.core.JobState;
import io.fleetcron.core.SkipReason;
import io.fleetcron.core.Splay;
import io.fleetcron.core.Trigger;
import io.fleetcron.core.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Decides whether a job is due at a given instant.
 *
 * <p>The evaluator holds no per-job state: everything it needs comes from the {@link JobSpec} and
 * the {@link JobState}, and everything it learns goes back into {@link Evaluation#state()}. The
 * only impurity is the random source used for splay, which is drawn once per due-cycle and stored
 * in {@link JobState#splayUntil()}.
 *
 * <p>{@code tolerance} is the scheduler's loop interval; explicit skip times match an occurrence
 * within that distance.
 */
public final class TriggerEvaluator {
    private static final Logger log = LoggerFactory.getLogger(TriggerEvaluator.class);

    private final Duration tolerance;
    private final Random random;

    public TriggerEvaluator(Duration tolerance, Random random) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        if (tolerance.isNegative() || tolerance.isZero()) {
            throw new IllegalArgumentException("tolerance must be a positive duration");
        }
    }

    public TriggerEvaluator(Duration tolerance) {
        this(tolerance, new Random());
    }

    public Evaluation evaluate(JobSpec spec, JobState current, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(now, "now must not be null");

        JobState state = current == null ? JobState.fresh() : current;
        if (state.anchor() == null) {
            state = state.withAnchor(now);
        }

        if (state.lastRun() != null && now.isBefore(state.lastRun())) {
            log.warn("Clock moved backwards for job={} now={} lastRun={}; not firing", spec.name(), now, state.lastRun());
            return Evaluation.notDue(state, state.nextFireTime(), SkipReason.CLOCK_SKEW);
        }

        if (spec.until() != null && !now.isBefore(spec.until())) {
            log.debug("Until time has passed, skipping job={}", spec.name());
            return Evaluation.notDue(state.withNextFireTime(null), null, SkipReason.UNTIL_PASSED);
        }

        state = dropStaleSkips(state, now);

        Instant fireAt = scheduledFireTime(spec, state);
        boolean explicit = false;
        if (!state.runExplicit().isEmpty()) {
            Instant explicitRun = state.runExplicit().get(0);
            if (fireAt == null || !explicitRun.isAfter(fireAt)) {
                fireAt = explicitRun;
                explicit = true;
            }
        }

        if (fireAt == null) {
            return Evaluation.notDue(state.withNextFireTime(null), null, null);
        }
        state = state.withNextFireTime(fireAt);

        if (spec.after() != null && !now.isAfter(spec.after())) {
            log.debug("After time has not passed, skipping job={}", spec.name());
            Instant eligible = fireAt.isAfter(spec.after()) ? fireAt : spec.after();
            return Evaluation.notDue(state, eligible, SkipReason.BEFORE_AFTER);
        }

        if (fireAt.isAfter(now)) {
            return Evaluation.notDue(state, fireAt, null);
        }

        Instant effective = fireAt;
        Splay splay = spec.splay();
        if (splay != null && !splay.isNone() && !explicit) {
            Instant splayUntil = state.splayUntil();
            if (splayUntil == null || splayUntil.isBefore(fireAt)) {
                long offset = splay.start() + random.nextLong(splay.end() - splay.start() + 1);
                splayUntil = fireAt.plusSeconds(offset);
                state = state.withSplayUntil(splayUntil);
                log.debug("Adding splay of {} seconds to next run of job={}", offset, spec.name());
            }
            if (now.isBefore(splayUntil)) {
                return Evaluation.notDue(state, splayUntil, null);
            }
            effective = splayUntil;
        }

        ZoneId zone = spec.zone();
        if (spec.range() != null && !spec.range().permits(now, zone)) {
            log.debug("Job={} is outside its range, holding", spec.name());
            return Evaluation.notDue(state.withSkipReason(SkipReason.OUTSIDE_RANGE), effective, SkipReason.OUTSIDE_RANGE);
        }
        if (spec.skipDuringRange() != null && spec.skipDuringRange().contains(now, zone)) {
            log.debug("Job={} is inside skip_during_range, holding", spec.name());
            return Evaluation.notDue(state.withSkipReason(SkipReason.SKIP_DURING_RANGE), effective, SkipReason.SKIP_DURING_RANGE);
        }

        if (explicit) {
            state = state.withRunExplicit(state.runExplicit().subList(1, state.runExplicit().size()));
        }

        Instant skip = matchingSkip(state, effective);
        if (skip != null) {
            List<Instant> remaining = new ArrayList<>(state.skipExplicit());
            remaining.remove(skip);
            JobState consumed = state.withSkipExplicit(remaining).consumed(now, SkipReason.SKIP_EXPLICIT);
            log.info("Skipping occurrence {} of job={} (skip_explicit)", effective, spec.name());
            return new Evaluation(false, effective, consumed, false, SkipReason.SKIP_EXPLICIT, Duration.ZERO);
        }

        Duration missedBy = Duration.between(effective, now);
        boolean terminal = !explicit && spec.trigger().type() == TriggerType.ONCE;
        return Evaluation.due(state, effective, terminal, missedBy.isNegative() ? Duration.ZERO : missedBy);
    }

    /**
     * The occurrence the trigger alone points at, ignoring splay, windows and explicit runs.
     */
    Instant scheduledFireTime(JobSpec spec, JobState state) {
        Trigger trigger = spec.trigger();
        Instant lastRun = state.lastRun();
        Instant anchor = state.anchor();

        return switch (trigger.type()) {
            case INTERVAL -> {
                if (lastRun != null) {
                    yield lastRun.plus(trigger.interval());
                }
                yield spec.effectiveRunOnStart() ? anchor : anchor.plus(trigger.interval());
            }
            case CRON -> {
                if (lastRun == null && spec.effectiveRunOnStart()) {
                    yield anchor;
                }
                Instant base = lastRun != null ? lastRun : anchor;
                yield IntervalParser.nextCronTime(trigger.cron(), spec.zone(), base);
            }
            case ONCE -> (lastRun != null || state.runCount() > 0) ? null : trigger.once();
            case WHEN -> {
                for (Instant w : trigger.when()) {
                    boolean pending = lastRun != null
                            ? w.isAfter(lastRun)
                            : !w.isBefore(anchor.minus(tolerance));
                    if (pending) {
                        yield w;
                    }
                }
                yield null;
            }
        };
    }

    private Instant matchingSkip(JobState state, Instant occurrence) {
        for (Instant s : state.skipExplicit()) {
            if (!occurrence.isBefore(s.minus(tolerance)) && occurrence.isBefore(s.plus(tolerance))) {
                return s;
            }
        }
        return null;
    }

    private JobState dropStaleSkips(JobState state, Instant now) {
        if (state.skipExplicit().isEmpty()) {
            return state;
        }
        Instant horizon = now.minus(tolerance);
        List<Instant> live = state.skipExplicit().stream()
                .filter(s -> !s.isBefore(horizon))
                .toList();
        return live.size() == state.skipExplicit().size() ? state : state.withSkipExplicit(live);
    }
}
