package io.fleetcron.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Random delay window in seconds added to a due time.
 */
public record Splay(long start, long end) {

    public Splay {
        if (start < 0) {
            throw new ConfigException(null, "splay start must be >= 0");
        }
        if (end < start) {
            throw new ConfigException(null, "invalid splay, end must be larger than start");
        }
    }

    public static Splay upTo(long seconds) {
        return new Splay(0, seconds);
    }

    @JsonIgnore
    public boolean isNone() {
        return end == 0;
    }
}
