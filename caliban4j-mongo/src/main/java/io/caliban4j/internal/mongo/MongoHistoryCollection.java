package io.caliban4j.internal.mongo;

import io.caliban4j.Query;
import io.caliban4j.core.Clause;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.core.RetryPolicy;
import io.caliban4j.internal.AbstractHistoryCollection;
import io.caliban4j.internal.EntityCodec;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One history collection stored as raw BSON documents whose {@code _id} is the entity id.
 */
public class MongoHistoryCollection<T extends HistoryObject> extends AbstractHistoryCollection<T> {

    static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final RetryPolicy retryPolicy;

    public MongoHistoryCollection(CollectionKey<T> key, EntityCodec codec, MongoTemplate mongoTemplate,
                                  RetryPolicy retryPolicy) {
        super(key, codec);
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    MongoTemplate mongoTemplate() {
        return mongoTemplate;
    }

    RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    protected Query<T> newQuery(Clause first) {
        return new MongoQuery<>(this, List.of(first), null, null, null);
    }

    @Override
    public Optional<Map<String, Object>> findDocument(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Document doc = mongoTemplate.findById(id, Document.class, name());
        return Optional.ofNullable(doc).map(MongoHistoryCollection::fromBson);
    }

    @Override
    public void insertDocument(String id, Map<String, Object> document) {
        mongoTemplate.insert(toBson(id, document), name());
    }

    @Override
    public void replaceDocument(String id, Map<String, Object> document) {
        mongoTemplate.save(toBson(id, document), name());
    }

    @Override
    public void deleteDocument(String id) {
        mongoTemplate.remove(new org.springframework.data.mongodb.core.query.Query(Criteria.where(ID).is(id)), name());
    }

    private static Document toBson(String id, Map<String, Object> document) {
        Document doc = new Document(ID, id);
        doc.putAll(document);
        return doc;
    }

    static Map<String, Object> fromBson(Document doc) {
        Map<String, Object> map = new LinkedHashMap<>(doc);
        map.remove(ID);
        return map;
    }
}
