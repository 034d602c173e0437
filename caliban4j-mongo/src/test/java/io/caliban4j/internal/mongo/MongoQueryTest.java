package io.caliban4j.internal.mongo;

import io.caliban4j.Query;
import io.caliban4j.core.Clause;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.Job;
import io.caliban4j.core.QueryOp;
import io.caliban4j.core.RetryPolicy;
import io.caliban4j.core.StorageException;
import io.caliban4j.internal.EntityCodec;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoQueryTest {

    private final EntityCodec codec = new EntityCodec();
    private MongoTemplate mongoTemplate;
    private MongoHistoryCollection<Job> jobs;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        jobs = new MongoHistoryCollection<>(CollectionKey.JOBS, codec, mongoTemplate,
                new RetryPolicy(3, Duration.ZERO, Duration.ZERO));
    }

    private Document stored(String id, String user, int a, long millis) {
        Job job = new Job(id, "sweep-" + id, "e1", user, Instant.ofEpochMilli(millis), List.of(), Map.of("a", a));
        Document doc = new Document("_id", id);
        doc.putAll(codec.encode(job));
        return doc;
    }

    private org.springframework.data.mongodb.core.query.Query captured() {
        ArgumentCaptor<org.springframework.data.mongodb.core.query.Query> captor =
                ArgumentCaptor.forClass(org.springframework.data.mongodb.core.query.Query.class);
        verify(mongoTemplate).find(captor.capture(), eq(Document.class), eq("jobs"));
        return captor.getValue();
    }

    @Test
    void singleClauseShouldPushSortAndLimitToServer() {
        when(mongoTemplate.find(any(), eq(Document.class), eq("jobs")))
                .thenReturn(List.of(stored("j2", "alice", 1, 2000), stored("j1", "alice", 0, 1000)));

        List<String> ids = jobs.where("user", QueryOp.EQ, "alice")
                .orderBy("timestamp", Query.Direction.DESCENDING)
                .limit(2)
                .execute()
                .map(Job::id)
                .collect(Collectors.toList());

        assertEquals(List.of("j2", "j1"), ids);
        org.springframework.data.mongodb.core.query.Query query = captured();
        assertEquals(new Document("user", "alice"), query.getQueryObject());
        assertEquals(new Document("timestamp", -1), query.getSortObject());
        assertEquals(2, query.getLimit());
    }

    @Test
    void laterClausesShouldBeAppliedLocally() {
        when(mongoTemplate.find(any(), eq(Document.class), eq("jobs"))).thenReturn(List.of(
                stored("j1", "alice", 0, 1000),
                stored("j2", "alice", 3, 2000),
                stored("j3", "alice", 1, 3000),
                stored("j4", "alice", 2, 4000)));

        List<String> ids = jobs.where("user", QueryOp.EQ, "alice")
                .where("kwargs.a", QueryOp.GE, 1)
                .orderBy("kwargs.a", Query.Direction.ASCENDING)
                .limit(2)
                .execute()
                .map(Job::id)
                .collect(Collectors.toList());

        assertEquals(List.of("j3", "j4"), ids);
        org.springframework.data.mongodb.core.query.Query query = captured();
        assertEquals(new Document("user", "alice"), query.getQueryObject());
        assertEquals(new Document(), query.getSortObject());
        assertEquals(0, query.getLimit());
    }

    @Test
    void clausesShouldTranslateToCriteria() {
        assertEquals(new Document("kwargs.a", new Document("$lt", 2)),
                MongoQuery.criteria(Clause.of("kwargs.a", QueryOp.LT, 2)).getCriteriaObject());
        assertEquals(new Document("timestamp", new Document("$gte", 1000L)),
                MongoQuery.criteria(Clause.of("timestamp", QueryOp.GE, Instant.ofEpochMilli(1000))).getCriteriaObject());
        assertEquals(new Document("platform", new Document("$in", List.of("GKE", "CAIP"))),
                MongoQuery.criteria(Clause.of("platform", QueryOp.IN, List.of("GKE", "CAIP"))).getCriteriaObject());
        assertEquals(new Document("user", new Document("$exists", true)),
                MongoQuery.criteria(Clause.of("user", QueryOp.IN, "alice,bob")).getCriteriaObject());
    }

    @Test
    void transientFailureShouldBeRetried() {
        when(mongoTemplate.find(any(), eq(Document.class), eq("jobs")))
                .thenThrow(new DataAccessResourceFailureException("primary stepped down"))
                .thenReturn(List.of(stored("j1", "alice", 0, 1000)));

        assertEquals(1, jobs.where("user", QueryOp.EQ, "alice").execute().count());
        verify(mongoTemplate, times(2)).find(any(), eq(Document.class), eq("jobs"));
    }

    @Test
    void permanentFailureShouldSurfaceAsStorageException() {
        when(mongoTemplate.find(any(), eq(Document.class), eq("jobs")))
                .thenThrow(new InvalidDataAccessApiUsageException("bad query"));

        Query<Job> query = jobs.where("user", QueryOp.EQ, "alice");

        assertThrows(StorageException.class, query::execute);
        verify(mongoTemplate, times(1)).find(any(), eq(Document.class), eq("jobs"));
    }
}
