package io.fleetcron.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fleetcron.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The rule deciding when a job becomes due. Exactly one of the kind-specific fields is set,
 * matching {@link #type()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Trigger(
        TriggerType type,
        Duration interval,
        String cron,
        Instant once,
        List<Instant> when
) {

    public Trigger {
        if (type == null) {
            throw new ConfigException(null, "trigger type must not be null");
        }
        switch (type) {
            case INTERVAL -> {
                if (interval == null || interval.isZero() || interval.isNegative()) {
                    throw new ConfigException(null, "interval must be a positive duration");
                }
            }
            case CRON -> {
                if (cron == null || !IntervalParser.looksLikeCron(cron)) {
                    throw new ConfigException(null, "invalid cron expression: " + cron);
                }
            }
            case ONCE -> {
                if (once == null) {
                    throw new ConfigException(null, "once trigger requires a timestamp");
                }
            }
            case WHEN -> {
                if (when == null || when.isEmpty()) {
                    throw new ConfigException(null, "when trigger requires at least one timestamp");
                }
                when = when.stream().sorted().distinct().toList();
            }
        }
    }

    public static Trigger interval(Duration interval) {
        return new Trigger(TriggerType.INTERVAL, interval, null, null, null);
    }

    public static Trigger cron(String expression) {
        return new Trigger(TriggerType.CRON, null, expression, null, null);
    }

    public static Trigger once(Instant at) {
        return new Trigger(TriggerType.ONCE, null, null, at, null);
    }

    public static Trigger when(List<Instant> times) {
        return new Trigger(TriggerType.WHEN, null, null, null, times);
    }
}
