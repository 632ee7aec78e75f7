package io.fleetcron.utils;

import io.fleetcron.core.JobSpec;
import io.fleetcron.core.JobState;
import io.fleetcron.core.SkipReason;
import io.fleetcron.core.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T09:30:00Z");

    private final TriggerEvaluator evaluator = new TriggerEvaluator(Duration.ofSeconds(1), new Random(42));

    @Test
    void intervalJobShouldBeDueOnceIntervalHasElapsed() {
        JobSpec spec = intervalJob(10).build();

        Evaluation due = evaluator.evaluate(spec, ranAt(NOW.minusSeconds(10)), NOW);
        assertTrue(due.due());
        assertEquals(Duration.ZERO, due.missedBy());

        Evaluation early = evaluator.evaluate(spec, ranAt(NOW.minusSeconds(5)), NOW);
        assertFalse(early.due());
        assertEquals(NOW.plusSeconds(5), early.nextEligible());
        assertEquals(NOW.plusSeconds(5), early.state().nextFireTime());
    }

    @Test
    void freshIntervalJobShouldFireOnFirstEvaluationUnlessRunOnStartIsOff() {
        assertTrue(evaluator.evaluate(intervalJob(10).build(), JobState.fresh(), NOW).due());

        Evaluation deferred = evaluator.evaluate(intervalJob(10).runOnStart(false).build(), JobState.fresh(), NOW);
        assertFalse(deferred.due());
        assertEquals(NOW.plusSeconds(10), deferred.nextEligible());
        assertEquals(NOW, deferred.state().anchor());
    }

    @Test
    void splayShouldBeDrawnOnceAndStayWithinBounds() {
        JobSpec spec = intervalJob(60).splay(10, 30).build();

        Evaluation first = evaluator.evaluate(spec, ranAt(NOW.minusSeconds(60)), NOW);
        assertFalse(first.due());
        Instant splayUntil = first.state().splayUntil();
        assertTrue(!splayUntil.isBefore(NOW.plusSeconds(10)) && !splayUntil.isAfter(NOW.plusSeconds(30)));

        Evaluation again = evaluator.evaluate(spec, first.state(), NOW.plusSeconds(1));
        assertEquals(splayUntil, again.state().splayUntil());
        assertFalse(again.due());

        Evaluation fired = evaluator.evaluate(spec, again.state(), splayUntil);
        assertTrue(fired.due());
        assertEquals(splayUntil, fired.nextEligible());
        assertNull(fired.state().fired(splayUntil).splayUntil());
    }

    @Test
    void cronOccurrencesShouldIncreaseMonotonically() {
        JobSpec spec = JobSpec.builder("report").function("test.ping").cron("*/5 * * * *").timezone("UTC").build();
        Instant t = Instant.parse("2026-01-01T00:01:00Z");

        Evaluation first = evaluator.evaluate(spec, JobState.fresh(), t);
        assertFalse(first.due());
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), first.nextEligible());

        Instant previous = null;
        JobState state = first.state();
        for (int i = 0; i < 4; i++) {
            Instant fireAt = state.nextFireTime();
            Evaluation due = evaluator.evaluate(spec, state, fireAt);
            assertTrue(due.due());
            if (previous != null) {
                assertTrue(fireAt.isAfter(previous));
            }
            previous = fireAt;
            state = evaluator.evaluate(spec, due.state().fired(fireAt), fireAt.plusSeconds(1)).state();
        }
        assertEquals(Instant.parse("2026-01-01T00:25:00Z"), state.nextFireTime());
    }

    @Test
    void onceJobShouldBeTerminalAndNeverFireTwice() {
        Instant target = NOW.plusSeconds(30);
        JobSpec spec = JobSpec.builder("migrate").function("test.ping").once(target).build();

        assertFalse(evaluator.evaluate(spec, JobState.fresh(), NOW).due());

        Evaluation due = evaluator.evaluate(spec, JobState.fresh().withAnchor(NOW), target.plusSeconds(2));
        assertTrue(due.due());
        assertTrue(due.terminal());
        assertEquals(Duration.ofSeconds(2), due.missedBy());

        Evaluation after = evaluator.evaluate(spec, due.state().fired(target.plusSeconds(2)), target.plusSeconds(60));
        assertFalse(after.due());
        assertNull(after.nextEligible());
    }

    @Test
    void whenJobShouldWalkThroughItsTimes() {
        Instant t1 = NOW;
        Instant t2 = NOW.plusSeconds(3600);
        JobSpec spec = JobSpec.builder("patch").function("test.ping").when(t2, t1).build();

        Evaluation first = evaluator.evaluate(spec, JobState.fresh(), t1);
        assertTrue(first.due());
        assertFalse(first.terminal());

        Evaluation next = evaluator.evaluate(spec, first.state().fired(t1), t1.plusSeconds(1));
        assertFalse(next.due());
        assertEquals(t2, next.nextEligible());
    }

    @Test
    void skipWindowShouldHoldJobWithoutAdvancingBookkeeping() {
        JobSpec spec = intervalJob(10)
                .skipDuringRange(TimeRange.of("09:00", "10:00"))
                .timezone("UTC")
                .build();
        JobState state = ranAt(NOW.minusSeconds(20));

        Evaluation held = evaluator.evaluate(spec, state, NOW);
        assertFalse(held.due());
        assertEquals(SkipReason.SKIP_DURING_RANGE, held.skipReason());
        assertEquals(state.lastRun(), held.state().lastRun());
        assertEquals(state.runCount(), held.state().runCount());

        Evaluation released = evaluator.evaluate(spec, held.state(), Instant.parse("2026-01-01T10:00:01Z"));
        assertTrue(released.due());
    }

    @Test
    void rangeShouldRestrictAndInvertShouldFlip() {
        JobState state = ranAt(NOW.minusSeconds(20));

        JobSpec inside = intervalJob(10).range(TimeRange.of("09:00", "10:00")).timezone("UTC").build();
        assertTrue(evaluator.evaluate(inside, state, NOW).due());

        JobSpec inverted = intervalJob(10).range(new TimeRange("09:00", "10:00", true)).timezone("UTC").build();
        Evaluation held = evaluator.evaluate(inverted, state, NOW);
        assertFalse(held.due());
        assertEquals(SkipReason.OUTSIDE_RANGE, held.skipReason());
    }

    @Test
    void clockMovingBackwardsShouldNotFire() {
        Evaluation evaluation = evaluator.evaluate(intervalJob(10).build(), ranAt(NOW.plusSeconds(30)), NOW);

        assertFalse(evaluation.due());
        assertEquals(SkipReason.CLOCK_SKEW, evaluation.skipReason());
    }

    @Test
    void untilAndAfterShouldBoundTheSchedule() {
        JobSpec expired = intervalJob(10).until(NOW.minusSeconds(1)).build();
        assertEquals(SkipReason.UNTIL_PASSED, evaluator.evaluate(expired, ranAt(NOW.minusSeconds(20)), NOW).skipReason());

        JobSpec notYet = intervalJob(10).after(NOW.plusSeconds(300)).build();
        Evaluation waiting = evaluator.evaluate(notYet, ranAt(NOW.minusSeconds(20)), NOW);
        assertFalse(waiting.due());
        assertEquals(SkipReason.BEFORE_AFTER, waiting.skipReason());
        assertEquals(NOW.plusSeconds(300), waiting.nextEligible());
    }

    @Test
    void explicitSkipShouldConsumeTheOccurrence() {
        JobSpec spec = intervalJob(10).build();
        JobState state = ranAt(NOW.minusSeconds(10)).addSkipExplicit(NOW);

        Evaluation skipped = evaluator.evaluate(spec, state, NOW);

        assertFalse(skipped.due());
        assertEquals(SkipReason.SKIP_EXPLICIT, skipped.skipReason());
        assertEquals(NOW, skipped.state().lastRun());
        assertEquals(1, skipped.state().runCount());
        assertTrue(skipped.state().skipExplicit().isEmpty());

        Evaluation next = evaluator.evaluate(spec, skipped.state(), NOW.plusSeconds(10));
        assertTrue(next.due());
    }

    @Test
    void explicitRunShouldFireAheadOfTheTrigger() {
        JobSpec spec = intervalJob(3600).build();
        JobState state = ranAt(NOW.minusSeconds(10)).addRunExplicit(NOW.minusSeconds(1));

        Evaluation due = evaluator.evaluate(spec, state, NOW);

        assertTrue(due.due());
        assertTrue(due.state().runExplicit().isEmpty());
    }

    @Test
    void sameInputsShouldGiveSameDecision() {
        JobSpec spec = intervalJob(10).build();
        JobState persisted = ranAt(NOW.minusSeconds(12));

        Evaluation beforeCrash = evaluator.evaluate(spec, persisted, NOW);
        Evaluation afterRestart = new TriggerEvaluator(Duration.ofSeconds(1), new Random(7)).evaluate(spec, persisted, NOW);

        assertEquals(beforeCrash, afterRestart);
    }

    private static JobSpec.Builder intervalJob(long seconds) {
        return JobSpec.builder("heartbeat").function("test.ping").seconds(seconds);
    }

    private static JobState ranAt(Instant lastRun) {
        return new JobState(lastRun, 1, null, null, lastRun.minusSeconds(3600), null, null, null);
    }
}
