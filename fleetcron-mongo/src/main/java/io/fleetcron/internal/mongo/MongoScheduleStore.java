package io.fleetcron.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleetcron.core.JobSpec;
import io.fleetcron.core.JobState;
import io.fleetcron.core.PersistenceException;
import io.fleetcron.core.ScheduleSnapshot;
import io.fleetcron.core.ScheduledJob;
import io.fleetcron.core.SkipReason;
import io.fleetcron.spi.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence layer for the schedule registry.
 *
 * <p>A save inserts the whole snapshot as a new generation of {@link ScheduledJobDocument}s, then
 * points {@link ScheduleSettingsDocument#getGeneration()} at it and finally removes older
 * generations. Readers only see the generation the settings document points at, so a save
 * interrupted at any step leaves the previous snapshot readable.
 */
public class MongoScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public ScheduleSnapshot load() {
        try {
            ScheduleSettingsDocument settings = mongoTemplate.findById(ScheduleSettingsDocument.ID, ScheduleSettingsDocument.class);
            if (settings == null) {
                return ScheduleSnapshot.empty();
            }
            Query q = new Query(Criteria.where("generation").is(settings.getGeneration()));
            Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
            for (ScheduledJobDocument doc : mongoTemplate.find(q, ScheduledJobDocument.class)) {
                jobs.put(doc.getName(), toJob(doc));
            }
            log.debug("Schedule loaded from mongo generation={} jobs={}", settings.getGeneration(), jobs.size());
            return new ScheduleSnapshot(settings.isEnabled(), jobs);
        } catch (DataAccessException ex) {
            throw new PersistenceException("Failed to load schedule from mongo", ex);
        } catch (IllegalArgumentException ex) {
            throw new PersistenceException("Stored schedule could not be converted: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void save(ScheduleSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        try {
            ScheduleSettingsDocument current = mongoTemplate.findById(ScheduleSettingsDocument.ID, ScheduleSettingsDocument.class);
            long generation = current == null ? 1 : current.getGeneration() + 1;

            List<ScheduledJobDocument> docs = new ArrayList<>(snapshot.jobs().size());
            for (ScheduledJob job : snapshot.jobs().values()) {
                docs.add(toDocument(job, generation));
            }
            // drop leftovers of an earlier interrupted save that used the same generation
            mongoTemplate.remove(new Query(Criteria.where("generation").is(generation)), ScheduledJobDocument.class);
            if (!docs.isEmpty()) {
                mongoTemplate.insert(docs, ScheduledJobDocument.class);
            }

            Update pointer = new Update()
                    .set("enabled", snapshot.enabled())
                    .set("generation", generation);
            mongoTemplate.upsert(new Query(Criteria.where("_id").is(ScheduleSettingsDocument.ID)), pointer, ScheduleSettingsDocument.class);

            long removed = mongoTemplate.remove(new Query(Criteria.where("generation").ne(generation)), ScheduledJobDocument.class)
                    .getDeletedCount();
            log.debug("Schedule saved to mongo generation={} jobs={} removed={}", generation, docs.size(), removed);
        } catch (DataAccessException ex) {
            throw new PersistenceException("Failed to save schedule to mongo", ex);
        }
    }

    private ScheduledJobDocument toDocument(ScheduledJob job, long generation) {
        JobState state = job.state();
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setName(job.name());
        doc.setGeneration(generation);
        doc.setEnabled(job.spec().enabled());
        doc.setSpec(objectMapper.convertValue(job.spec(), new TypeReference<>() {
        }));
        doc.setLastRun(state.lastRun());
        doc.setRunCount(state.runCount());
        doc.setNextFireTime(state.nextFireTime());
        doc.setSplayUntil(state.splayUntil());
        doc.setAnchor(state.anchor());
        doc.setLastSkipReason(state.lastSkipReason() == null ? null : state.lastSkipReason().name());
        doc.setSkipExplicit(state.skipExplicit());
        doc.setRunExplicit(state.runExplicit());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScheduledJob, long)}.
     */
    ScheduledJob toJob(ScheduledJobDocument doc) {
        JobSpec spec = objectMapper.convertValue(doc.getSpec(), JobSpec.class);
        JobState state = new JobState(
                doc.getLastRun(),
                doc.getRunCount(),
                doc.getNextFireTime(),
                doc.getSplayUntil(),
                doc.getAnchor(),
                doc.getLastSkipReason() == null ? null : SkipReason.valueOf(doc.getLastSkipReason()),
                doc.getSkipExplicit(),
                doc.getRunExplicit());
        return new ScheduledJob(spec, state);
    }
}
