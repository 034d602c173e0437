package io.caliban4j.internal.mongo;

import io.caliban4j.core.Clause;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.HistoryObject;
import io.caliban4j.core.Result;
import io.caliban4j.core.StorageException;
import io.caliban4j.internal.AbstractQuery;
import io.caliban4j.utils.Retries;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Query that sends only its first clause to the server.
 *
 * <p>Combined filters would need a composite index per field pair, so the server evaluates
 * the first clause alone and every clause is re-checked locally. Ordering and limit are
 * pushed down only for single-clause queries; otherwise they are applied after the local
 * filter.
 */
public class MongoQuery<T extends HistoryObject> extends AbstractQuery<T> {
    private static final Logger log = LoggerFactory.getLogger(MongoQuery.class);

    private final MongoHistoryCollection<T> collection;

    MongoQuery(MongoHistoryCollection<T> collection, List<Clause> clauses, String orderField,
               Direction direction, Integer limit) {
        super(clauses, orderField, direction, limit);
        this.collection = collection;
    }

    @Override
    protected AbstractQuery<T> copy(List<Clause> clauses, String orderField, Direction direction, Integer limit) {
        return new MongoQuery<>(collection, clauses, orderField, direction, limit);
    }

    /**
     * The server-side part of this query.
     */
    Query serverQuery() {
        Query query = new Query(criteria(clauses.get(0)));
        if (clauses.size() == 1) {
            if (orderField != null) {
                query.with(Sort.by(direction == Direction.DESCENDING ? Sort.Direction.DESC : Sort.Direction.ASC,
                        orderField));
            }
            if (limit != null) {
                query.limit(limit);
            }
        }
        return query;
    }

    @Override
    public Stream<T> execute() {
        Query query = serverQuery();
        log.debug("executing query collection={} server={} local={}", collection.name(), query, this);

        Result<List<Document>> fetched = Retries.call(collection.retryPolicy(), "query " + collection.name(),
                () -> collection.mongoTemplate().find(query, Document.class, collection.name()),
                MongoQuery::isTransient);
        List<Document> docs = fetched.value().orElseThrow(() -> {
            ConnectError error = fetched.error().orElseThrow();
            return new StorageException(error.message(), error.cause());
        });

        Stream<Map<String, Object>> matches = docs.stream()
                .map(MongoHistoryCollection::fromBson)
                .filter(doc -> matchesAll(clauses, doc));
        if (clauses.size() > 1) {
            if (orderField != null) {
                List<Map<String, Object>> sorted = matches.sorted(localOrder()).collect(Collectors.toList());
                matches = sorted.stream();
            }
            if (limit != null) {
                matches = matches.limit(limit);
            }
        }
        return matches.map(collection::decode);
    }

    static Criteria criteria(Clause clause) {
        Criteria where = Criteria.where(clause.field());
        Object value = clause.value();
        return switch (clause.op()) {
            case LT -> where.lt(value);
            case LE -> where.lte(value);
            case GT -> where.gt(value);
            case GE -> where.gte(value);
            case EQ -> where.is(value);
            // a string operand is a substring test, which is checked locally
            case IN -> value instanceof List<?> values ? where.in(values) : where.exists(true);
        };
    }

    private Comparator<Map<String, Object>> localOrder() {
        Comparator<Object> values = Comparator.nullsLast(MongoQuery::compareValues);
        Comparator<Map<String, Object>> order =
                (a, b) -> values.compare(sortKey(Clause.lookup(a, orderField)), sortKey(Clause.lookup(b, orderField)));
        return direction == Direction.DESCENDING ? order.reversed() : order;
    }

    private static Object sortKey(Object value) {
        return value instanceof Number || value instanceof String ? value : null;
    }

    private static int compareValues(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        // numbers before strings
        return a instanceof Number ? -1 : 1;
    }

    private static boolean isTransient(Exception e) {
        return e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException;
    }
}
