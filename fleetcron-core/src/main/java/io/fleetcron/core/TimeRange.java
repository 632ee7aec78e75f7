package io.fleetcron.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fleetcron.utils.IntervalParser;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Window used by {@code range} and {@code skip_during_range}.
 *
 * <p>Both bounds are either a time of day ({@code "22:00"}, a daily window which may wrap
 * midnight) or an absolute date-time ({@code "2026-03-01T08:00:00"}); mixing the two is rejected.
 * {@code invert} flips membership and is only meaningful for {@code range}.
 */
public record TimeRange(String start, String end, boolean invert) {

    public TimeRange {
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            throw new ConfigException(null, "range requires both start and end");
        }
        LocalTime startOfDay = IntervalParser.parseTimeOfDay(start);
        LocalTime endOfDay = IntervalParser.parseTimeOfDay(end);
        if ((startOfDay == null) != (endOfDay == null)) {
            throw new ConfigException(null, "range bounds must both be times of day or both be date-times");
        }
        if (startOfDay != null) {
            if (startOfDay.equals(endOfDay)) {
                throw new ConfigException(null, "invalid range, start and end are equal");
            }
        } else {
            Instant s = parseBound(start, ZoneOffset.UTC);
            Instant e = parseBound(end, ZoneOffset.UTC);
            if (!e.isAfter(s)) {
                throw new ConfigException(null, "invalid range, end must be larger than start");
            }
        }
    }

    public static TimeRange of(String start, String end) {
        return new TimeRange(start, end, false);
    }

    @JsonIgnore
    public boolean isDaily() {
        return IntervalParser.parseTimeOfDay(start) != null;
    }

    /**
     * Whether {@code now} falls inside the window (bounds inclusive), ignoring {@link #invert()}.
     */
    public boolean contains(Instant now, ZoneId zone) {
        LocalTime startOfDay = IntervalParser.parseTimeOfDay(start);
        if (startOfDay != null) {
            LocalTime endOfDay = IntervalParser.parseTimeOfDay(end);
            LocalTime t = now.atZone(zone).toLocalTime();
            if (startOfDay.isBefore(endOfDay)) {
                return !t.isBefore(startOfDay) && !t.isAfter(endOfDay);
            }
            // wraps midnight
            return !t.isBefore(startOfDay) || !t.isAfter(endOfDay);
        }
        Instant s = parseBound(start, zone);
        Instant e = parseBound(end, zone);
        return !now.isBefore(s) && !now.isAfter(e);
    }

    /**
     * Whether a job restricted to this range may run at {@code now}, honouring {@link #invert()}.
     */
    public boolean permits(Instant now, ZoneId zone) {
        boolean inside = contains(now, zone);
        return invert != inside;
    }

    private static Instant parseBound(String value, ZoneId zone) {
        try {
            return IntervalParser.parseInstant(value, null, zone);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException(null, "invalid date string in range: " + value, ex);
        }
    }
}
