package io.caliban4j.config;

import io.caliban4j.Storage;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.internal.mongo.MongoStorage;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.List;
import java.util.Map;

/**
 * MongoDB index definitions for the history collections.
 *
 * <p>Indexes are not created at startup unless {@code caliban.history.ensure-indexes-on-startup}
 * is set; production databases usually manage them with migration scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>ux_uniqueKey</b> (unique + partial) on {@code container_specs}, {@code experiments}
 *       and {@code job_specs}: { uniqueKey: 1 } where uniqueKey exists.
 *       <br/>Backs get-or-create deduplication.</li>
 *   <li><b>idx_name_user</b> on {@code experiment_groups}: { name: 1, user: 1 }</li>
 *   <li><b>idx_xgroup</b> on {@code experiments}: { xgroup: 1, timestamp: 1 }</li>
 *   <li><b>idx_experiment_timestamp</b> on {@code jobs}: { experiment: 1, timestamp: 1 }</li>
 *   <li><b>idx_user_timestamp</b> on {@code jobs}: { user: 1, timestamp: -1 }</li>
 *   <li><b>idx_job_timestamp</b> on {@code runs}: { job: 1, timestamp: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.experiments.createIndex(
 *   { uniqueKey: 1 },
 *   { name: "ux_uniqueKey", unique: true, partialFilterExpression: { uniqueKey: { $exists: true } } }
 * );
 * db.jobs.createIndex({ experiment: 1, timestamp: 1 }, { name: "idx_experiment_timestamp" });
 * </pre>
 */
public class HistoryMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(HistoryMongoIndexConfig.class);

    public static final String UX_UNIQUE_KEY = "ux_uniqueKey";
    public static final String IDX_NAME_USER = "idx_name_user";
    public static final String IDX_XGROUP = "idx_xgroup";
    public static final String IDX_EXPERIMENT_TIMESTAMP = "idx_experiment_timestamp";
    public static final String IDX_USER_TIMESTAMP = "idx_user_timestamp";
    public static final String IDX_JOB_TIMESTAMP = "idx_job_timestamp";

    private final Storage storage;

    public HistoryMongoIndexConfig(Storage storage) {
        this.storage = storage;
    }

    /**
     * Creates every index in {@link #indexes()}. Does nothing for a store that is not on Mongo,
     * which is the case after a fallback.
     */
    public void ensureIndexes() {
        if (!(storage instanceof MongoStorage mongo)) {
            log.info("skipping index creation, history store is not mongo storage={}", storage.getClass().getSimpleName());
            return;
        }
        MongoTemplate mongoTemplate = mongo.mongoTemplate();
        indexes().forEach((collection, indexes) -> {
            for (Index index : indexes) {
                mongoTemplate.indexOps(collection).createIndex(index);
            }
        });
        log.info("history indexes ensured database={}", mongoTemplate.getDb().getName());
    }

    public static Map<String, List<Index>> indexes() {
        return Map.of(
                CollectionKey.CONTAINER_SPECS.name(), List.of(uniqueKeyIndex()),
                CollectionKey.EXPERIMENTS.name(), List.of(uniqueKeyIndex(), xgroupIndex()),
                CollectionKey.JOB_SPECS.name(), List.of(uniqueKeyIndex()),
                CollectionKey.EXPERIMENT_GROUPS.name(), List.of(nameUserIndex()),
                CollectionKey.JOBS.name(), List.of(experimentTimestampIndex(), userTimestampIndex()),
                CollectionKey.RUNS.name(), List.of(jobTimestampIndex())
        );
    }

    /**
     * Unique dedup key. Keys: uniqueKey ASC. Options: unique + partialFilterExpression
     * { uniqueKey: { $exists: true } }
     */
    public static Index uniqueKeyIndex() {
        return new Index()
                .on("uniqueKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("uniqueKey", new Document("$exists", true))))
                .named(UX_UNIQUE_KEY);
    }

    public static Index nameUserIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .on("user", Sort.Direction.ASC)
                .named(IDX_NAME_USER);
    }

    public static Index xgroupIndex() {
        return new Index()
                .on("xgroup", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.ASC)
                .named(IDX_XGROUP);
    }

    public static Index experimentTimestampIndex() {
        return new Index()
                .on("experiment", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.ASC)
                .named(IDX_EXPERIMENT_TIMESTAMP);
    }

    /**
     * Recent jobs per user. Keys: user ASC, timestamp DESC
     */
    public static Index userTimestampIndex() {
        return new Index()
                .on("user", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.DESC)
                .named(IDX_USER_TIMESTAMP);
    }

    public static Index jobTimestampIndex() {
        return new Index()
                .on("job", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.ASC)
                .named(IDX_JOB_TIMESTAMP);
    }
}
