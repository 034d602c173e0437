package io.caliban4j.internal.mongo;

import com.mongodb.client.MongoClient;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.core.RetryPolicy;
import io.caliban4j.internal.AbstractHistoryCollection;
import io.caliban4j.internal.DocumentStorage;
import io.caliban4j.internal.EntityCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * History store on a MongoDB database, one collection per entity type.
 */
public class MongoStorage extends DocumentStorage {
    private static final Logger log = LoggerFactory.getLogger(MongoStorage.class);

    private final MongoTemplate mongoTemplate;
    private final MongoClient ownedClient;
    private final Map<String, MongoHistoryCollection<?>> collections = new LinkedHashMap<>();

    public MongoStorage(MongoTemplate mongoTemplate, EntityCodec codec, Clock clock, RetryPolicy retryPolicy) {
        this(mongoTemplate, null, codec, clock, retryPolicy);
    }

    /**
     * @param ownedClient closed together with this store; null when the caller owns the client
     */
    public MongoStorage(MongoTemplate mongoTemplate, MongoClient ownedClient, EntityCodec codec, Clock clock,
                        RetryPolicy retryPolicy) {
        super(codec, clock);
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.ownedClient = ownedClient;
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        for (CollectionKey<?> key : CollectionKey.all()) {
            collections.put(key.name(), newCollection(key, retryPolicy));
        }
    }

    private <T extends HistoryObject> MongoHistoryCollection<T> newCollection(CollectionKey<T> key, RetryPolicy retryPolicy) {
        return new MongoHistoryCollection<>(key, codec, mongoTemplate, retryPolicy);
    }

    public MongoTemplate mongoTemplate() {
        return mongoTemplate;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected <T extends HistoryObject> AbstractHistoryCollection<T> historyCollection(CollectionKey<T> key) {
        MongoHistoryCollection<?> collection = collections.get(key.name());
        if (collection == null) {
            throw new IllegalArgumentException("unknown collection: " + key.name());
        }
        return (MongoHistoryCollection<T>) collection;
    }

    @Override
    public void close() {
        if (ownedClient != null) {
            ownedClient.close();
        }
        log.info("mongo history store closed database={}", mongoTemplate.getDb().getName());
    }
}
