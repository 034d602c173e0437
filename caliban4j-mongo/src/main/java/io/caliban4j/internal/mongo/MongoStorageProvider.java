package io.caliban4j.internal.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.caliban4j.Storage;
import io.caliban4j.StorageProvider;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;
import io.caliban4j.core.RetryPolicy;
import io.caliban4j.internal.EntityCodec;
import io.caliban4j.utils.Retries;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Opens {@code mongodb://} and {@code mongodb+srv://} URLs.
 *
 * <p>The server is pinged before the store is handed out, with a short server-selection
 * timeout, so an unreachable database fails fast and the caller can fall back.
 */
public class MongoStorageProvider implements StorageProvider {
    private static final Logger log = LoggerFactory.getLogger(MongoStorageProvider.class);

    private final EntityCodec codec;
    private final Clock clock;
    private final String defaultDatabase;
    private final Duration serverSelectionTimeout;
    private final RetryPolicy retryPolicy;

    public MongoStorageProvider(EntityCodec codec, Clock clock, String defaultDatabase,
                                Duration serverSelectionTimeout, RetryPolicy retryPolicy) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultDatabase = Objects.requireNonNull(defaultDatabase, "defaultDatabase must not be null");
        this.serverSelectionTimeout = Objects.requireNonNull(serverSelectionTimeout, "serverSelectionTimeout must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    @Override
    public boolean supports(String url) {
        return url != null && (url.startsWith("mongodb://") || url.startsWith("mongodb+srv://"));
    }

    @Override
    public Result<Storage> connect(String url) {
        ConnectionString connection;
        try {
            connection = new ConnectionString(url);
        } catch (IllegalArgumentException e) {
            return Result.err(ConnectError.permanent("invalid mongodb connection string: " + e.getMessage(), e));
        }
        String database = connection.getDatabase() == null ? defaultDatabase : connection.getDatabase();

        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connection)
                .applyToClusterSettings(b -> b.serverSelectionTimeout(serverSelectionTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .build();
        MongoClient client = MongoClients.create(settings);
        MongoTemplate mongoTemplate = new MongoTemplate(client, database);

        Result<Document> ping = Retries.call(retryPolicy, "ping " + connection.getHosts(),
                () -> mongoTemplate.executeCommand(new Document("ping", 1)),
                MongoStorageProvider::isTransient);
        if (!ping.isOk()) {
            client.close();
            return Result.err(ping.error().orElseThrow());
        }

        log.info("connected to mongo hosts={} database={}", connection.getHosts(), database);
        return Result.ok(new MongoStorage(mongoTemplate, client, codec, clock, retryPolicy));
    }

    private static boolean isTransient(Exception e) {
        return e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException;
    }
}
