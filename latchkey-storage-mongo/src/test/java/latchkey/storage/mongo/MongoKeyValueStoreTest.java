package latchkey.storage.mongo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.MongoSocketException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import latchkey.api.store.KeyValueStoreException;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.concurrent.TimeUnit;

@ExtendWith(MockitoExtension.class)
class MongoKeyValueStoreTest {

  private static final String KEY = "//mutex/invoice-run";
  private static final Instant NOW = Instant.parse("2024-06-01T08:30:00Z");

  @Mock private MongoCollection<Document> collection;
  @Mock private FindIterable<Document> findIterable;

  private MongoKeyValueStore store;

  @BeforeEach
  void setUp() {
    when(collection.createIndex(any(Bson.class), any(IndexOptions.class)))
        .thenReturn("expire_at_ttl");
    store =
        new MongoKeyValueStore(
            collection,
            new MongoCommandExecutor(2, Duration.ZERO),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void constructor_createsTtlIndex() {
    ArgumentCaptor<IndexOptions> options = ArgumentCaptor.forClass(IndexOptions.class);
    verify(collection).createIndex(any(Bson.class), options.capture());

    assertThat(options.getValue().getExpireAfter(TimeUnit.SECONDS)).isZero();
  }

  @Test
  void setIfAbsent_purgesExpiredDocumentBeforeInsert() {
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(1));
    when(collection.insertOne(any(Document.class)))
        .thenReturn(InsertOneResult.acknowledged(new BsonString(KEY)));

    assertThat(store.setIfAbsent(KEY, "1717230600")).isTrue();

    InOrder order = inOrder(collection);
    order.verify(collection).deleteOne(any(Bson.class));
    ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
    order.verify(collection).insertOne(inserted.capture());
    assertThat(inserted.getValue())
        .containsEntry("_id", KEY)
        .containsEntry("value", "1717230600")
        .doesNotContainKey("expire_at");
  }

  @Test
  void setIfAbsentWithTtl_storesExpirationTime() {
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));
    when(collection.insertOne(any(Document.class)))
        .thenReturn(InsertOneResult.acknowledged(new BsonString(KEY)));

    assertThat(store.setIfAbsent(KEY, "1717230600", 120)).isTrue();

    ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
    verify(collection).insertOne(inserted.capture());
    assertThat(inserted.getValue().get("expire_at", Date.class))
        .isEqualTo(Date.from(NOW.plusSeconds(120)));
  }

  @Test
  void setIfAbsent_returnsFalseOnDuplicateKey() {
    MongoWriteException duplicate = mock(MongoWriteException.class);
    when(duplicate.getCode()).thenReturn(11000);
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));
    when(collection.insertOne(any(Document.class))).thenThrow(duplicate);

    assertThat(store.setIfAbsent(KEY, "1717230600")).isFalse();
  }

  @Test
  void setIfAbsent_otherWriteErrorsAreStoreFailures() {
    MongoWriteException rejected = mock(MongoWriteException.class);
    when(rejected.getCode()).thenReturn(121);
    when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));
    when(collection.insertOne(any(Document.class))).thenThrow(rejected);

    assertThatThrownBy(() -> store.setIfAbsent(KEY, "1717230600"))
        .isInstanceOf(KeyValueStoreException.class)
        .hasCause(rejected);
    verify(collection, times(1)).insertOne(any(Document.class));
  }

  @Test
  void get_readsValueOfLiveDocument() {
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(new Document("_id", KEY).append("value", "1717230000"));

    assertThat(store.get(KEY)).contains("1717230000");
  }

  @Test
  void get_returnsEmptyWhenNoLiveDocument() {
    when(collection.find(any(Bson.class))).thenReturn(findIterable);
    when(findIterable.first()).thenReturn(null);

    assertThat(store.get(KEY)).isEmpty();
  }

  @Test
  void expire_reportsWhetherALiveDocumentMatched() {
    when(collection.updateOne(any(Bson.class), any(Bson.class)))
        .thenReturn(UpdateResult.acknowledged(1, 1L, null))
        .thenReturn(UpdateResult.acknowledged(0, 0L, null));

    assertThat(store.expire(KEY, 30)).isTrue();
    assertThat(store.expire(KEY, 30)).isFalse();
  }

  @Test
  void exists_countsLiveDocuments() {
    when(collection.countDocuments(any(Bson.class), any(CountOptions.class))).thenReturn(1L, 0L);

    assertThat(store.exists(KEY)).isTrue();
    assertThat(store.exists(KEY)).isFalse();
  }

  @Test
  void delete_isRetriedOnNetworkError() {
    when(collection.deleteOne(any(Bson.class)))
        .thenThrow(new MongoSocketException("connection reset", new ServerAddress()))
        .thenReturn(DeleteResult.acknowledged(1));

    store.delete(KEY);

    verify(collection, times(2)).deleteOne(any(Bson.class));
  }

  @Test
  void delete_failsAfterRetriesAreExhausted() {
    when(collection.deleteOne(any(Bson.class)))
        .thenThrow(new MongoSocketException("connection refused", new ServerAddress()));

    assertThatThrownBy(() -> store.delete(KEY))
        .isInstanceOf(KeyValueStoreException.class)
        .hasCauseInstanceOf(MongoSocketException.class);
    verify(collection, times(3)).deleteOne(any(Bson.class));
    verify(collection, never()).insertOne(any(Document.class));
  }

  @Test
  void executor_rejectsMissingRetryDelay() {
    assertThatThrownBy(() -> new MongoCommandExecutor(2, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("retryDelay cannot be null");
  }
}
