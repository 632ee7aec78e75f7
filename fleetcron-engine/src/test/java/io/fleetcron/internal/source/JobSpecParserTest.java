package io.fleetcron.internal.source;

import io.fleetcron.core.ConfigException;
import io.fleetcron.core.JobSpec;
import io.fleetcron.core.RunScope;
import io.fleetcron.core.Splay;
import io.fleetcron.core.TriggerType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSpecParserTest {

    @Test
    void shouldSumIntervalUnitsAndReadExecutionOptions() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("function", "state.apply");
        item.put("job_args", List.of("web"));
        item.put("kwargs", Map.of("test", true));
        item.put("minutes", 1);
        item.put("seconds", "30");
        item.put("splay", Map.of("start", 5, "end", 10));
        item.put("maxrunning", 3);
        item.put("maxrunning_scope", "cluster");
        item.put("jid_include", "yes");
        item.put("return_job", "off");
        item.put("semaphore", Map.of("resource", "db"));

        JobSpec spec = JobSpecParser.parse("apply", item);

        assertThat(spec.name()).isEqualTo("apply");
        assertThat(spec.args()).containsExactly("web");
        assertThat(spec.kwargs()).containsEntry("test", true);
        assertThat(spec.trigger().type()).isEqualTo(TriggerType.INTERVAL);
        assertThat(spec.trigger().interval()).isEqualTo(Duration.ofSeconds(90));
        assertThat(spec.splay()).isEqualTo(new Splay(5, 10));
        assertThat(spec.maxRunning()).isEqualTo(3);
        assertThat(spec.maxRunningScope()).isEqualTo(RunScope.CLUSTER);
        assertThat(spec.jidInclude()).isTrue();
        assertThat(spec.returnJob()).isFalse();
        assertThat(spec.semaphore().resource()).isEqualTo("db");
        assertThat(spec.semaphore().maxConcurrent()).isEqualTo(1);
    }

    @Test
    void shouldReadDateTriggersInTheJobTimezone() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("function", "report.send");
        item.put("when", List.of("2026-03-01 08:00", "2026-03-01T06:00:00Z"));
        item.put("timezone", "Europe/Berlin");

        JobSpec spec = JobSpecParser.parse("report", item);

        assertThat(spec.trigger().when()).containsExactly(
                Instant.parse("2026-03-01T06:00:00Z"),
                Instant.parse("2026-03-01T07:00:00Z"));
    }

    @Test
    void onceShouldHonourItsFormat() {
        JobSpec spec = JobSpecParser.parse("migrate", Map.of(
                "function", "db.migrate",
                "once", "01/02/2026 10:15",
                "once_fmt", "dd/MM/yyyy HH:mm",
                "timezone", "UTC"));

        assertThat(spec.trigger().once()).isEqualTo(Instant.parse("2026-02-01T10:15:00Z"));
    }

    @Test
    void rangesShouldBeParsed() {
        JobSpec spec = JobSpecParser.parse("night", Map.of(
                "function", "test.ping",
                "cron", "*/5 * * * *",
                "range", Map.of("start", "22:00", "end", "06:00", "invert", true),
                "skip_during_range", Map.of("start", "01:00", "end", "02:00", "invert", true)));

        assertThat(spec.range().invert()).isTrue();
        assertThat(spec.skipDuringRange().invert()).isFalse();
        assertThat(spec.skipDuringRange().start()).isEqualTo("01:00");
    }

    @Test
    void errorsShouldCarryTheJobName() {
        assertThatThrownBy(() -> JobSpecParser.parse("bad", Map.of("function", "x", "seconds", "ten")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("job bad")
                .hasMessageContaining("seconds must be a whole number");

        assertThatThrownBy(() -> JobSpecParser.parse("bad", Map.of("function", "x", "seconds", 5, "cron", "* * * * *")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("options together");

        assertThatThrownBy(() -> JobSpecParser.parse("bad", Map.of("function", "x", "when", "yesterday-ish")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("for \"when\" is invalid");

        assertThatThrownBy(() -> JobSpecParser.parse("bad", Map.of("function", "x", "seconds", 5, "range", "22:00")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("range is not a dict");

        assertThatThrownBy(() -> JobSpecParser.parse("bad", Map.of("function", "x", "seconds", 5, "splay", Map.of("start", 20, "end", 10))))
                .isInstanceOf(ConfigException.class)
                .satisfies(ex -> assertThat(((ConfigException) ex).jobName()).isEqualTo("bad"));
    }

    @Test
    void unknownKeysShouldBeIgnored() {
        JobSpec spec = JobSpecParser.parse("ping", Map.of("function", "test.ping", "seconds", 5, "colour", "blue"));

        assertThat(spec.trigger().interval()).isEqualTo(Duration.ofSeconds(5));
    }
}
