package io.fleetcron.internal.store;

import io.fleetcron.core.ScheduleSnapshot;
import io.fleetcron.spi.ScheduleStore;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the last saved snapshot in memory.
 */
public class InMemoryScheduleStore implements ScheduleStore {
    private volatile ScheduleSnapshot snapshot = ScheduleSnapshot.empty();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public ScheduleSnapshot load() {
        return snapshot;
    }

    @Override
    public void save(ScheduleSnapshot snapshot) {
        this.snapshot = snapshot;
        saves.incrementAndGet();
    }

    public ScheduleSnapshot last() {
        return snapshot;
    }

    public int saves() {
        return saves.get();
    }
}
