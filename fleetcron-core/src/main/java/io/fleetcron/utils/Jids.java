package io.fleetcron.utils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates run identifiers: a 20-digit UTC timestamp with microsecond resolution
 * ({@code yyyyMMddHHmmssSSSSSS}). Identifiers from one generator are strictly increasing.
 */
public final class Jids {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSSSSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong lastMicros = new AtomicLong();

    public Jids(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        Instant now = clock.instant();
        long micros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000;
        long unique = lastMicros.updateAndGet(prev -> Math.max(prev + 1, micros));
        Instant stamp = Instant.ofEpochSecond(unique / 1_000_000L, (unique % 1_000_000L) * 1_000L);
        return FORMAT.format(stamp);
    }
}
