package io.fleetcron.internal.store;

import io.fleetcron.core.JobSpec;
import io.fleetcron.core.JobState;
import io.fleetcron.core.ScheduleSnapshot;
import io.fleetcron.core.ScheduledJob;
import io.fleetcron.core.SkipReason;
import io.fleetcron.core.TimeRange;
import io.fleetcron.internal.ObjectMappers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileScheduleStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    @Test
    void savedSnapshotShouldLoadBackWithBookkeeping() {
        FileScheduleStore store = new FileScheduleStore(dir.resolve("state/schedule.json"), ObjectMappers.json());

        JobSpec spec = JobSpec.builder("report")
                .function("report.send", "daily")
                .kwarg("to", "ops")
                .cron("0 3 * * *")
                .timezone("Europe/Berlin")
                .range(new TimeRange("01:00", "05:00", false))
                .splay(5, 30)
                .semaphore("reports", 2)
                .maxRunning(2)
                .build();
        JobState state = JobState.fresh()
                .withAnchor(T0)
                .fired(T0.plusSeconds(60))
                .addSkipExplicit(T0.plusSeconds(3600))
                .addRunExplicit(T0.plusSeconds(7200))
                .withSkipReason(SkipReason.MAXRUNNING);
        Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
        jobs.put("report", new ScheduledJob(spec, state));

        store.save(new ScheduleSnapshot(false, jobs));
        ScheduleSnapshot loaded = store.load();

        assertFalse(loaded.enabled());
        ScheduledJob job = loaded.jobs().get("report");
        assertEquals(spec, job.spec());
        assertEquals(T0.plusSeconds(60), job.state().lastRun());
        assertEquals(1, job.state().runCount());
        assertEquals(T0, job.state().anchor());
        assertEquals(List.of(T0.plusSeconds(3600)), job.state().skipExplicit());
        assertEquals(List.of(T0.plusSeconds(7200)), job.state().runExplicit());
        assertFalse(Files.exists(dir.resolve("state/schedule.json.tmp")));
    }

    @Test
    void missingFileShouldLoadEmpty() {
        FileScheduleStore store = new FileScheduleStore(dir.resolve("absent.json"), ObjectMappers.json());

        ScheduleSnapshot loaded = store.load();

        assertTrue(loaded.enabled());
        assertTrue(loaded.jobs().isEmpty());
    }

    @Test
    void corruptFileShouldBeMovedAsideAndLoadEmpty() throws Exception {
        Path file = dir.resolve("schedule.json");
        Files.writeString(file, "{\"enabled\": tru", StandardCharsets.UTF_8);
        FileScheduleStore store = new FileScheduleStore(file, ObjectMappers.json());

        ScheduleSnapshot loaded = store.load();

        assertTrue(loaded.jobs().isEmpty());
        assertFalse(Files.exists(file));
        assertTrue(Files.exists(dir.resolve("schedule.json.corrupt")));
    }

    @Test
    void saveShouldReplacePreviousContent() {
        FileScheduleStore store = new FileScheduleStore(dir.resolve("schedule.json"), ObjectMappers.json());
        JobSpec a = JobSpec.builder("a").function("test.ping").seconds(10).build();
        JobSpec b = JobSpec.builder("b").function("test.ping").seconds(20).build();

        store.save(new ScheduleSnapshot(true, Map.of("a", new ScheduledJob(a, JobState.fresh()))));
        store.save(new ScheduleSnapshot(true, Map.of("b", new ScheduledJob(b, JobState.fresh()))));

        assertEquals(List.of("b"), List.copyOf(store.load().jobs().keySet()));
    }
}
