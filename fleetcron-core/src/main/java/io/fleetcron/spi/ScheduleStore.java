package io.fleetcron.spi;

import io.fleetcron.core.PersistenceException;
import io.fleetcron.core.ScheduleSnapshot;

/**
 * Durable storage for the registry (specs plus bookkeeping).
 */
public interface ScheduleStore {

    /**
     * Loads the last saved snapshot; returns an empty snapshot when nothing was saved yet.
     *
     * @throws PersistenceException when stored data exists but cannot be read
     */
    ScheduleSnapshot load();

    /**
     * Replaces the stored snapshot. Must be atomic: a crash leaves either the old or the new content.
     *
     * @throws PersistenceException when the write fails
     */
    void save(ScheduleSnapshot snapshot);
}
