package io.fleetcron.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Registry-wide settings; a single document with id {@value #ID}.
 */
@Document(collection = "fleetcron_settings")
public class ScheduleSettingsDocument {

    public static final String ID = "schedule";

    @Id
    private String id = ID;

    private boolean enabled = true;
    private long generation;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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
}
