package io.fleetcron.internal.source;

import io.fleetcron.core.ConfigException;
import io.fleetcron.core.JobSpec;
import io.fleetcron.core.RunScope;
import io.fleetcron.core.TimeRange;
import io.fleetcron.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns one schedule item (the key/value form used in schedule files) into a {@link JobSpec}.
 *
 * <p>Recognised keys: {@code function, args, kwargs, seconds, minutes, hours, days, cron, once,
 * once_fmt, when, after, until, splay, maxrunning, maxrunning_scope, jid_include, run_on_start,
 * enabled, range, skip_during_range, return_job, metadata, semaphore, timezone}. {@code job_args}
 * and {@code job_kwargs} are accepted as aliases. Unknown keys are logged and ignored.
 */
public final class JobSpecParser {
    private static final Logger log = LoggerFactory.getLogger(JobSpecParser.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
            "function", "args", "job_args", "kwargs", "job_kwargs",
            "seconds", "minutes", "hours", "days", "cron", "once", "once_fmt", "when",
            "after", "until", "splay", "maxrunning", "maxrunning_scope", "jid_include", "run_on_start",
            "enabled", "range", "skip_during_range", "return_job", "metadata", "semaphore", "timezone", "name");

    private JobSpecParser() {
    }

    public static JobSpec parse(String name, Map<String, Object> item) {
        if (name == null || name.isBlank()) {
            throw new ConfigException(null, "Job name is required.");
        }
        try {
            return build(name, item);
        } catch (ConfigException ex) {
            if (ex.jobName() == null) {
                throw new ConfigException(name, ex.getMessage(), ex);
            }
            throw ex;
        }
    }

    private static JobSpec build(String name, Map<String, Object> item) {
        if (item == null) {
            throw new ConfigException(name, "scheduled job must be a mapping");
        }
        for (String key : item.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown schedule key job={} key={}", name, key);
            }
        }

        ZoneId zone = zone(name, item.get("timezone"));
        JobSpec.Builder b = JobSpec.builder(name)
                .function(string(name, item, "function"))
                .timezone(item.get("timezone") == null ? null : item.get("timezone").toString());

        Object args = item.containsKey("args") ? item.get("args") : item.get("job_args");
        if (args != null) {
            b.args(args instanceof List<?> list ? list : List.of(args));
        }
        Object kwargs = item.containsKey("kwargs") ? item.get("kwargs") : item.get("job_kwargs");
        if (kwargs != null) {
            b.kwargs(map(name, "kwargs", kwargs));
        }

        for (String unit : List.of("seconds", "minutes", "hours", "days")) {
            Object v = item.get(unit);
            if (v == null) {
                continue;
            }
            long n = number(name, unit, v);
            switch (unit) {
                case "seconds" -> b.seconds(n);
                case "minutes" -> b.minutes(n);
                case "hours" -> b.hours(n);
                default -> b.days(n);
            }
        }

        if (item.get("cron") != null) {
            b.cron(item.get("cron").toString());
        }
        if (item.get("once") != null) {
            Object fmt = item.get("once_fmt");
            b.once(instant(name, "once", item.get("once"), fmt == null ? null : fmt.toString(), zone));
        }
        if (item.get("when") != null) {
            Object when = item.get("when");
            List<Instant> times = new ArrayList<>();
            for (Object w : when instanceof List<?> list ? list : List.of(when)) {
                times.add(instant(name, "when", w, null, zone));
            }
            b.when(times);
        }
        if (item.get("after") != null) {
            b.after(instant(name, "after", item.get("after"), null, zone));
        }
        if (item.get("until") != null) {
            b.until(instant(name, "until", item.get("until"), null, zone));
        }

        Object splay = item.get("splay");
        if (splay instanceof Map<?, ?> m) {
            b.splay(number(name, "splay.start", m.get("start") == null ? 0 : m.get("start")),
                    number(name, "splay.end", required(name, "splay.end", m.get("end"))));
        } else if (splay != null) {
            b.splay(number(name, "splay", splay));
        }

        if (item.get("maxrunning") != null) {
            b.maxRunning((int) number(name, "maxrunning", item.get("maxrunning")));
        }
        if (item.get("maxrunning_scope") != null) {
            String scope = item.get("maxrunning_scope").toString().trim().toUpperCase(Locale.ROOT);
            try {
                b.maxRunningScope(RunScope.valueOf(scope));
            } catch (IllegalArgumentException ex) {
                throw new ConfigException(name, "maxrunning_scope must be local or cluster", ex);
            }
        }
        if (item.get("jid_include") != null) {
            b.jidInclude(bool(name, "jid_include", item.get("jid_include")));
        }
        if (item.get("run_on_start") != null) {
            b.runOnStart(bool(name, "run_on_start", item.get("run_on_start")));
        }
        if (item.get("enabled") != null) {
            b.enabled(bool(name, "enabled", item.get("enabled")));
        }
        if (item.get("return_job") != null) {
            b.returnJob(bool(name, "return_job", item.get("return_job")));
        }
        if (item.get("metadata") != null) {
            b.metadata(map(name, "metadata", item.get("metadata")));
        }
        if (item.get("range") != null) {
            b.range(range(name, "range", item.get("range"), true));
        }
        if (item.get("skip_during_range") != null) {
            b.skipDuringRange(range(name, "skip_during_range", item.get("skip_during_range"), false));
        }
        if (item.get("semaphore") != null) {
            Map<String, Object> sem = map(name, "semaphore", item.get("semaphore"));
            Object max = sem.get("max") != null ? sem.get("max") : 1;
            b.semaphore(string(name, sem, "resource"), (int) number(name, "semaphore.max", max));
        }

        return b.build();
    }

    private static TimeRange range(String name, String key, Object value, boolean allowInvert) {
        Map<String, Object> m = map(name, key, value);
        Object start = required(name, key + ".start", m.get("start"));
        Object end = required(name, key + ".end", m.get("end"));
        boolean invert = allowInvert && m.get("invert") != null && bool(name, key + ".invert", m.get("invert"));
        return new TimeRange(start.toString(), end.toString(), invert);
    }

    private static Instant instant(String name, String key, Object value, String pattern, ZoneId zone) {
        if (value instanceof Date d) {
            return d.toInstant();
        }
        if (value instanceof Instant i) {
            return i;
        }
        try {
            return IntervalParser.parseInstant(value.toString(), pattern, zone);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException(name, "Schedule item " + value + " for \"" + key + "\" is invalid.", ex);
        }
    }

    private static ZoneId zone(String name, Object value) {
        if (value == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(value.toString());
        } catch (DateTimeException ex) {
            throw new ConfigException(name, "invalid timezone: " + value, ex);
        }
    }

    private static String string(String name, Map<String, Object> m, String key) {
        Object v = m.get(key);
        if (v == null || v.toString().isBlank()) {
            throw new ConfigException(name, key + " is required");
        }
        return v.toString();
    }

    private static Object required(String name, String key, Object value) {
        if (value == null) {
            throw new ConfigException(name, key + " is required");
        }
        return value;
    }

    private static long number(String name, String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new ConfigException(name, key + " must be a whole number, got: " + value, ex);
        }
    }

    private static boolean bool(String name, String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new ConfigException(name, key + " must be a boolean, got: " + value);
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(String name, String key, Object value) {
        if (value instanceof Map<?, ?> m) {
            return (Map<String, Object>) m;
        }
        throw new ConfigException(name, key + " is not a dict. please correct and try again.");
    }
}
