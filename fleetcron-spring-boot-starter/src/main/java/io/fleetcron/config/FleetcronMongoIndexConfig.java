package io.fleetcron.config;

import io.fleetcron.internal.mongo.ScheduledJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the schedule store.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code fleetcron.ensure-indexes-on-startup=true};
 * in production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code fleetcron_jobs})</h3>
 * <ul>
 *   <li><b>ux_generation_name</b> (unique): { generation: 1, name: 1 }
 *       <br/>Used by every load and by the cleanup of older generations; one entry per job per generation.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.fleetcron_jobs.createIndex({ generation: 1, name: 1 }, { name: "ux_generation_name", unique: true });
 * </pre>
 */
public class FleetcronMongoIndexConfig {

    public static final String UX_GENERATION_NAME = "ux_generation_name";

    private final MongoTemplate mongoTemplate;

    public FleetcronMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(generationNameIndex());
    }

    public static Index generationNameIndex() {
        return new Index()
                .on("generation", Sort.Direction.ASC)
                .on("name", Sort.Direction.ASC)
                .unique()
                .named(UX_GENERATION_NAME);
    }
}
