package io.fleetcron.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.quartz.CronExpression;

/**
 * Parses the textual parts of a schedule entry.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron expressions: 5-field (minute first) or 6-field (seconds first), evaluated with Quartz</li>
 *   <li>Date-times: ISO instants, offset or local ISO date-times, or a custom pattern</li>
 *   <li>Times of day: "HH:mm" or "HH:mm:ss"</li>
 * </ul>
 */
public final class IntervalParser {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^\\d{1,2}:\\d{2}(:\\d{2})?$");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private IntervalParser() {
    }

    /**
     * Next cron occurrence strictly after {@code after}.
     *
     * @param cron  5- or 6-field cron expression
     * @param zone  zone the expression is evaluated in; null means system default
     * @param after exclusive lower bound
     * @return next occurrence, or {@code null} when the expression produces no further time
     */
    public static Instant nextCronTime(String cron, ZoneId zone, Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        String quartz = normalizeCron(cron);
        CronExpression exp;
        try {
            exp = new CronExpression(quartz);
        } catch (Exception ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));

        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron (seconds first).
     * - Accepts 5-field cron by prepending seconds "0".
     * - Translates numeric day-of-week from cron (0/7 = Sunday) to Quartz (1 = Sunday).
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("?".equals(dom) || "?".equals(dow)) {
            return String.join(" ", sec, min, hour, dom, month, dow);
        }

        dow = translateDayOfWeek(dow);
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String translateDayOfWeek(String dow) {
        if ("*".equals(dow)) {
            return dow;
        }
        StringBuilder out = new StringBuilder();
        String[] items = dow.split(",");
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            int slash = item.indexOf('/');
            String range = slash >= 0 ? item.substring(0, slash) : item;
            String step = slash >= 0 ? item.substring(slash) : "";

            Matcher m = NUMBER.matcher(range);
            StringBuilder translated = new StringBuilder();
            while (m.find()) {
                int day = Integer.parseInt(m.group());
                m.appendReplacement(translated, Integer.toString((day % 7) + 1));
            }
            m.appendTail(translated);
            out.append(translated).append(step);
        }
        return out.toString();
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Parses a date-time string into an instant.
     *
     * @param value   ISO instant ("2026-01-01T10:00:00Z"), ISO offset date-time, ISO local date-time,
     *                or a value matching {@code pattern}
     * @param pattern optional {@link DateTimeFormatter} pattern for local date-times (e.g. "yyyy-MM-dd HH:mm")
     * @param zone    zone for values without an offset; null means system default
     */
    public static Instant parseInstant(String value, String pattern, ZoneId zone) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Date string must not be empty");
        }
        String s = value.trim();
        ZoneId z = zone != null ? zone : ZoneId.systemDefault();

        if (pattern != null && !pattern.isBlank()) {
            try {
                return LocalDateTime.parse(s, DateTimeFormatter.ofPattern(pattern)).atZone(z).toInstant();
            } catch (DateTimeParseException | IllegalArgumentException ex) {
                throw new IllegalArgumentException("Date string could not be parsed: " + value + ", " + pattern, ex);
            }
        }

        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // fall through to the offset and local forms
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the local form
        }
        try {
            return LocalDateTime.parse(s.replace(' ', 'T')).atZone(z).toInstant();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Date string could not be parsed: " + value, ex);
        }
    }

    /**
     * Parses "HH:mm" or "HH:mm:ss"; returns {@code null} when {@code value} is not a time of day.
     */
    public static LocalTime parseTimeOfDay(String value) {
        if (value == null) {
            return null;
        }
        String s = value.trim();
        if (!TIME_OF_DAY.matcher(s).matches()) {
            return null;
        }
        try {
            return LocalTime.parse(s.length() == 4 || s.length() == 7 ? "0" + s : s);
        } catch (DateTimeException ex) {
            return null;
        }
    }
}
