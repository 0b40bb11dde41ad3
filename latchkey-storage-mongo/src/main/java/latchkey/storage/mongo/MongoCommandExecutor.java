package latchkey.storage.mongo;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import latchkey.api.Result;
import latchkey.api.store.KeyValueStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs MongoDB operations for a single key and turns their outcome into a {@link Result}.
 *
 * <p>Idempotent operations are retried on network errors, transient error labels and transient
 * server codes. Inserts are not, since a retried insert cannot tell its own earlier success from a
 * competing writer.
 */
final class MongoCommandExecutor {
  private static final Logger log = LoggerFactory.getLogger(MongoCommandExecutor.class);

  static final int DEFAULT_MAX_RETRIES = 2;
  static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(50);

  private final RetryPolicy<Object> transientFailureRetry;

  MongoCommandExecutor(int maxRetries, Duration retryDelay) {
    checkArgument(maxRetries >= 0, "maxRetries cannot be negative: %s", maxRetries);
    checkNotNull(retryDelay, "retryDelay cannot be null");
    this.transientFailureRetry =
        RetryPolicy.builder()
            .handleIf(MongoCommandExecutor::isTransient)
            .withMaxRetries(maxRetries)
            .withDelay(retryDelay)
            .onRetry(
                event ->
                    log.debug(
                        "Retrying MongoDB operation, attempt {}",
                        event.getAttemptCount() + 1,
                        event.getLastException()))
            .build();
  }

  private static boolean isTransient(Throwable throwable) {
    if (throwable instanceof MongoSocketException) {
      return true;
    }
    return throwable instanceof MongoException dbError
        && (dbError.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
            || MongoErrorCode.fromException(dbError).isTransient());
  }

  <R> Result<R> execute(String operation, String key, boolean idempotent, Supplier<R> block) {
    try {
      R value = idempotent ? Failsafe.with(transientFailureRetry).get(block::get) : block.get();
      return new Result.Success<>(value);
    } catch (MongoException e) {
      return new Result.Failure<>(
          new KeyValueStoreException(key, "MongoDB " + operation + " failed for " + key, e));
    } catch (FailsafeException e) {
      return new Result.Failure<>(
          new KeyValueStoreException(
              key, "MongoDB " + operation + " failed for " + key, e.getCause()));
    }
  }
}
