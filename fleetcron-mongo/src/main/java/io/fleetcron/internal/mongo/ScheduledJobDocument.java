package io.fleetcron.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for one persisted schedule entry.
 *
 * <p>Every save writes a complete new generation of entries; only the generation recorded in
 * {@link ScheduleSettingsDocument} is read back.
 */
@Document(collection = "fleetcron_jobs")
public class ScheduledJobDocument {

    @Id
    private String id;

    private String name;
    private long generation;
    private boolean enabled;
    private Map<String, Object> spec;

    private Instant lastRun;
    private long runCount;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextFireTime;

    private Instant splayUntil;
    private Instant anchor;
    private String lastSkipReason;
    private List<Instant> skipExplicit;
    private List<Instant> runExplicit;

    public ScheduledJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getGeneration() {
        return generation;
    }

    public void setGeneration(long generation) {
        this.generation = generation;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getSpec() {
        return spec;
    }

    public void setSpec(Map<String, Object> spec) {
        this.spec = spec;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public long getRunCount() {
        return runCount;
    }

    public void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    public Instant getNextFireTime() {
        return nextFireTime;
    }

    public void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    public Instant getSplayUntil() {
        return splayUntil;
    }

    public void setSplayUntil(Instant splayUntil) {
        this.splayUntil = splayUntil;
    }

    public Instant getAnchor() {
        return anchor;
    }

    public void setAnchor(Instant anchor) {
        this.anchor = anchor;
    }

    public String getLastSkipReason() {
        return lastSkipReason;
    }

    public void setLastSkipReason(String lastSkipReason) {
        this.lastSkipReason = lastSkipReason;
    }

    public List<Instant> getSkipExplicit() {
        return skipExplicit;
    }

    public void setSkipExplicit(List<Instant> skipExplicit) {
        this.skipExplicit = skipExplicit;
    }

    public List<Instant> getRunExplicit() {
        return runExplicit;
    }

    public void setRunExplicit(List<Instant> runExplicit) {
        this.runExplicit = runExplicit;
    }
}
