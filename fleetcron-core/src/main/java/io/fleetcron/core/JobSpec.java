package io.fleetcron.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable job definition. This is a pure data object; bookkeeping lives in {@link JobState}.
 *
 * <p>Build one with {@link #builder(String)}:
 * <pre>{@code
 * JobSpec spec = JobSpec.builder("highstate")
 *         .function("state.apply", "webserver")
 *         .minutes(30)
 *         .splay(60)
 *         .maxRunning(1)
 *         .build();
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSpec(

        // identity
        String name,

        // action
        String function,
        List<Object> args,
        Map<String, Object> kwargs,

        // scheduling
        Trigger trigger,
        Instant after,
        Instant until,
        Splay splay,
        Boolean runOnStart,
        TimeRange range,
        TimeRange skipDuringRange,
        String timezone,

        // execution
        int maxRunning,
        RunScope maxRunningScope,
        boolean jidInclude,
        SemaphoreSpec semaphore,
        boolean enabled,

        // results
        boolean returnJob,
        Map<String, Object> metadata
) {

    public JobSpec {
        if (name == null || name.isBlank()) {
            throw new ConfigException(null, "Job name is required.");
        }
        if (function == null || function.isBlank()) {
            throw new ConfigException(name, "function is required");
        }
        if (trigger == null) {
            throw new ConfigException(name, "one of seconds, minutes, hours, days, cron, once or when is required");
        }
        if (maxRunning < 1) {
            throw new ConfigException(name, "maxrunning must be >= 1");
        }
        if (timezone != null) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException ex) {
                throw new ConfigException(name, "invalid timezone: " + timezone, ex);
            }
        }
        if (after != null && until != null && !until.isAfter(after)) {
            throw new ConfigException(name, "until must be later than after");
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        maxRunningScope = maxRunningScope == null ? RunScope.LOCAL : maxRunningScope;
    }

    /**
     * Zone used for cron evaluation and for date strings without an offset.
     */
    @JsonIgnore
    public ZoneId zone() {
        return timezone == null ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }

    /**
     * Whether the first evaluation of a never-run job fires immediately.
     * Unset means yes for interval triggers and no for the others.
     */
    @JsonIgnore
    public boolean effectiveRunOnStart() {
        if (runOnStart != null) {
            return runOnStart;
        }
        return trigger.type() == TriggerType.INTERVAL;
    }

    public JobSpec withEnabled(boolean enabled) {
        return new JobSpec(name, function, args, kwargs, trigger, after, until, splay, runOnStart, range,
                skipDuringRange, timezone, maxRunning, maxRunningScope, jidInclude, semaphore, enabled,
                returnJob, metadata);
    }

    public JobSpec withName(String name) {
        return new JobSpec(name, function, args, kwargs, trigger, after, until, splay, runOnStart, range,
                skipDuringRange, timezone, maxRunning, maxRunningScope, jidInclude, semaphore, enabled,
                returnJob, metadata);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String function;
        private List<Object> args = new ArrayList<>();
        private Map<String, Object> kwargs = new LinkedHashMap<>();

        private long intervalSeconds;
        private String cron;
        private Instant once;
        private List<Instant> when;
        private Instant after;
        private Instant until;
        private Splay splay;
        private Boolean runOnStart;
        private TimeRange range;
        private TimeRange skipDuringRange;
        private String timezone;

        private int maxRunning = 1;
        private RunScope maxRunningScope = RunScope.LOCAL;
        private boolean jidInclude = true;
        private SemaphoreSpec semaphore;
        private boolean enabled = true;

        private boolean returnJob = true;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder function(String function, Object... args) {
            this.function = function;
            if (args != null && args.length > 0) {
                this.args = new ArrayList<>(Arrays.asList(args));
            }
            return this;
        }

        public Builder args(List<?> args) {
            this.args = args == null ? new ArrayList<>() : new ArrayList<>(args);
            return this;
        }

        public Builder kwargs(Map<String, ?> kwargs) {
            this.kwargs = kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs);
            return this;
        }

        public Builder kwarg(String key, Object value) {
            this.kwargs.put(key, value);
            return this;
        }

        public Builder seconds(long seconds) {
            this.intervalSeconds += seconds;
            return this;
        }

        public Builder minutes(long minutes) {
            this.intervalSeconds += minutes * 60L;
            return this;
        }

        public Builder hours(long hours) {
            this.intervalSeconds += hours * 3600L;
            return this;
        }

        public Builder days(long days) {
            this.intervalSeconds += days * 86400L;
            return this;
        }

        public Builder every(Duration interval) {
            this.intervalSeconds += interval.toSeconds();
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder once(Instant once) {
            this.once = once;
            return this;
        }

        public Builder when(Instant... times) {
            this.when = List.of(times);
            return this;
        }

        public Builder when(List<Instant> times) {
            this.when = times;
            return this;
        }

        public Builder after(Instant after) {
            this.after = after;
            return this;
        }

        public Builder until(Instant until) {
            this.until = until;
            return this;
        }

        public Builder splay(long maxSeconds) {
            this.splay = Splay.upTo(maxSeconds);
            return this;
        }

        public Builder splay(long startSeconds, long endSeconds) {
            this.splay = new Splay(startSeconds, endSeconds);
            return this;
        }

        public Builder runOnStart(Boolean runOnStart) {
            this.runOnStart = runOnStart;
            return this;
        }

        public Builder range(TimeRange range) {
            this.range = range;
            return this;
        }

        public Builder skipDuringRange(TimeRange skipDuringRange) {
            this.skipDuringRange = skipDuringRange;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder maxRunning(int maxRunning) {
            this.maxRunning = maxRunning;
            return this;
        }

        public Builder maxRunningScope(RunScope scope) {
            this.maxRunningScope = scope;
            return this;
        }

        public Builder jidInclude(boolean jidInclude) {
            this.jidInclude = jidInclude;
            return this;
        }

        public Builder semaphore(String resource, int maxConcurrent) {
            this.semaphore = new SemaphoreSpec(resource, maxConcurrent);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder returnJob(boolean returnJob) {
            this.returnJob = returnJob;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public JobSpec build() {
            return new JobSpec(name, function, args, kwargs, buildTrigger(), after, until, splay, runOnStart,
                    range, skipDuringRange, timezone, maxRunning, maxRunningScope, jidInclude, semaphore,
                    enabled, returnJob, metadata);
        }

        private Trigger buildTrigger() {
            boolean hasInterval = intervalSeconds != 0;
            int kinds = (hasInterval ? 1 : 0) + (cron != null ? 1 : 0) + (once != null ? 1 : 0) + (when != null ? 1 : 0);
            if (kinds > 1) {
                throw new ConfigException(name,
                        "Unable to use \"seconds\", \"minutes\", \"hours\", \"days\", \"cron\", \"once\" or \"when\" options together.");
            }
            try {
                if (hasInterval) {
                    return Trigger.interval(Duration.ofSeconds(intervalSeconds));
                }
                if (cron != null) {
                    return Trigger.cron(cron);
                }
                if (once != null) {
                    return Trigger.once(once);
                }
                if (when != null) {
                    return Trigger.when(when);
                }
            } catch (ConfigException ex) {
                throw new ConfigException(name, ex.getMessage(), ex);
            }
            return null;
        }
    }
}
