package io.fleetcron.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSpecTest {

    @Test
    void builderShouldApplyDefaults() {
        JobSpec spec = JobSpec.builder("highstate")
                .function("state.apply", "webserver")
                .minutes(30)
                .seconds(15)
                .build();

        assertThat(spec.trigger().type()).isEqualTo(TriggerType.INTERVAL);
        assertThat(spec.trigger().interval()).isEqualTo(Duration.ofSeconds(1815));
        assertThat(spec.args()).containsExactly("webserver");
        assertThat(spec.maxRunning()).isEqualTo(1);
        assertThat(spec.maxRunningScope()).isEqualTo(RunScope.LOCAL);
        assertThat(spec.jidInclude()).isTrue();
        assertThat(spec.enabled()).isTrue();
        assertThat(spec.returnJob()).isTrue();
        assertThat(spec.effectiveRunOnStart()).isTrue();
    }

    @Test
    void builderShouldRejectMixedTriggers() {
        assertThatThrownBy(() -> JobSpec.builder("mixed").function("test.ping").seconds(10).cron("* * * * *").build())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("options together");
    }

    @Test
    void missingTriggerShouldBeRejected() {
        assertThatThrownBy(() -> JobSpec.builder("idle").function("test.ping").build())
                .isInstanceOf(ConfigException.class)
                .satisfies(ex -> assertThat(((ConfigException) ex).jobName()).isEqualTo("idle"));
    }

    @Test
    void invalidCronShouldCarryJobName() {
        assertThatThrownBy(() -> JobSpec.builder("broken").function("test.ping").cron("61 * * * *").build())
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("job broken: invalid cron expression");
    }

    @Test
    void blankNameAndBadBoundsShouldBeRejected() {
        assertThatThrownBy(() -> JobSpec.builder(" ").function("test.ping").seconds(5).build())
                .hasMessage("Job name is required.");
        assertThatThrownBy(() -> JobSpec.builder("x").function("test.ping").seconds(5).maxRunning(0).build())
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> JobSpec.builder("x").function("test.ping").seconds(5).timezone("Mars/Olympus").build())
                .isInstanceOf(ConfigException.class);
        Instant t = Instant.parse("2026-01-01T00:00:00Z");
        assertThatThrownBy(() -> JobSpec.builder("x").function("test.ping").seconds(5).after(t).until(t).build())
                .hasMessageContaining("until must be later than after");
        assertThatThrownBy(() -> JobSpec.builder("x").function("test.ping").seconds(5).splay(30, 10).build())
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void argumentsMayContainNulls() {
        Map<String, Object> kwargs = new HashMap<>();
        kwargs.put("test", null);

        JobSpec spec = JobSpec.builder("x").function("test.echo").args(Arrays.asList("a", null)).kwargs(kwargs).seconds(5).build();

        assertThat(spec.args()).containsExactly("a", null);
        assertThat(spec.kwargs()).containsEntry("test", null);
    }

    @Test
    void cronJobsShouldNotRunOnStartByDefault() {
        JobSpec spec = JobSpec.builder("nightly").function("test.ping").cron("0 3 * * *").build();

        assertThat(spec.effectiveRunOnStart()).isFalse();
        assertThat(spec.withEnabled(false).enabled()).isFalse();
        assertThat(spec.withName("nightly-2").name()).isEqualTo("nightly-2");
    }

    @Test
    void timeRangeShouldHandleDailyWindowsAcrossMidnight() {
        TimeRange night = TimeRange.of("22:00", "06:00");

        assertThat(night.isDaily()).isTrue();
        assertThat(night.contains(Instant.parse("2026-01-01T23:30:00Z"), ZoneOffset.UTC)).isTrue();
        assertThat(night.contains(Instant.parse("2026-01-01T05:59:00Z"), ZoneOffset.UTC)).isTrue();
        assertThat(night.contains(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC)).isFalse();
    }

    @Test
    void timeRangeShouldRejectMixedOrInvertedBounds() {
        assertThatThrownBy(() -> TimeRange.of("22:00", "2026-01-01T06:00:00"))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TimeRange.of("2026-01-02T00:00:00", "2026-01-01T00:00:00"))
                .hasMessageContaining("end must be larger than start");
    }
}
