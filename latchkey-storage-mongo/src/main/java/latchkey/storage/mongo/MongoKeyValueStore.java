package latchkey.storage.mongo;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.lte;
import static com.mongodb.client.model.Filters.or;
import static com.mongodb.client.model.Updates.set;
import static latchkey.storage.mongo.LatchkeyCollectionNamespace.KEY_NAMESPACE;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import latchkey.api.store.ExpiringKeyValueStore;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExpiringKeyValueStore} on a MongoDB collection.
 *
 * <p>Document schema:
 *
 * <pre>{@code
 * {
 *   "_id": "//mutex/<name>",
 *   "value": "<epoch seconds>",
 *   "expire_at": ISODate(...)   // absent for keys without ttl
 * }
 * }</pre>
 *
 * <p>The server purges expired documents through a TTL index, but only about once a minute. Every
 * operation therefore treats a document whose {@code expire_at} has passed as absent, judged by
 * this client's clock. Uniqueness of {@code _id} makes {@link #setIfAbsent(String, String)}
 * atomic.
 */
@ThreadSafe
public class MongoKeyValueStore implements ExpiringKeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(MongoKeyValueStore.class);

  static final String VALUE = "value";
  static final String EXPIRE_AT = "expire_at";

  private final MongoCollection<Document> collection;
  private final MongoCommandExecutor executor;
  private final Clock clock;

  public MongoKeyValueStore(MongoClient client, String db) {
    this(
        client.getDatabase(db).getCollection(KEY_NAMESPACE),
        new MongoCommandExecutor(
            MongoCommandExecutor.DEFAULT_MAX_RETRIES, MongoCommandExecutor.DEFAULT_RETRY_DELAY),
        Clock.systemUTC());
  }

  @VisibleForTesting
  MongoKeyValueStore(
      MongoCollection<Document> collection, MongoCommandExecutor executor, Clock clock) {
    this.collection = checkNotNull(collection, "collection cannot be null");
    this.executor = checkNotNull(executor, "executor cannot be null");
    this.clock = checkNotNull(clock, "clock cannot be null");

    String index =
        executor
            .execute(
                "createIndex",
                EXPIRE_AT,
                true,
                () ->
                    collection.createIndex(
                        Indexes.ascending(EXPIRE_AT),
                        new IndexOptions().name("expire_at_ttl").expireAfter(0L, TimeUnit.SECONDS)))
            .getOrThrow();
    log.debug("Using TTL index {} on {}", index, collection.getNamespace());
  }

  @Override
  public boolean setIfAbsent(String key, String value) {
    return insert(key, new Document("_id", key).append(VALUE, value));
  }

  @Override
  public boolean setIfAbsent(String key, String value, long ttlSeconds) {
    return insert(
        key,
        new Document("_id", key)
            .append(VALUE, value)
            .append(EXPIRE_AT, Date.from(now().plusSeconds(ttlSeconds))));
  }

  private boolean insert(String key, Document document) {
    // An expired document still occupies its _id until the TTL monitor runs.
    executor
        .execute(
            "deleteOne",
            key,
            true,
            () -> collection.deleteOne(and(eq("_id", key), lte(EXPIRE_AT, Date.from(now())))))
        .getOrThrow();

    return executor
        .execute(
            "insertOne",
            key,
            false,
            () -> {
              try {
                collection.insertOne(document);
                return true;
              } catch (MongoWriteException e) {
                if (MongoErrorCode.fromException(e) == MongoErrorCode.DUPLICATE_KEY) {
                  return false;
                }
                throw e;
              }
            })
        .getOrThrow();
  }

  @Override
  public Optional<String> get(String key) {
    return executor
        .execute(
            "find",
            key,
            true,
            () ->
                Optional.ofNullable(collection.find(live(key)).first())
                    .map(document -> document.getString(VALUE)))
        .getOrThrow();
  }

  @Override
  public boolean expire(String key, long ttlSeconds) {
    Date expireAt = Date.from(now().plus(Duration.ofSeconds(ttlSeconds)));
    return executor
        .execute(
            "updateOne",
            key,
            true,
            () -> collection.updateOne(live(key), set(EXPIRE_AT, expireAt)).getMatchedCount() > 0)
        .getOrThrow();
  }

  @Override
  public void delete(String key) {
    executor
        .execute("deleteOne", key, true, () -> collection.deleteOne(eq("_id", key)))
        .getOrThrow();
  }

  @Override
  public boolean exists(String key) {
    return executor
        .execute(
            "countDocuments",
            key,
            true,
            () -> collection.countDocuments(live(key), new CountOptions().limit(1)) > 0)
        .getOrThrow();
  }

  private Bson live(String key) {
    return and(eq("_id", key), or(eq(EXPIRE_AT, null), gt(EXPIRE_AT, Date.from(now()))));
  }

  private Instant now() {
    return clock.instant();
  }
}
