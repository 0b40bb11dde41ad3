package latchkey.storage.redis;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import latchkey.api.Result;
import latchkey.api.store.KeyValueStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs Redis commands and turns their outcome into a {@link Result}.
 *
 * <p>Idempotent commands are retried on transient connection failures. {@code SETNX} is not: a
 * reply lost after the server applied it would make a retry report the caller's own key as held
 * by someone else.
 *
 * @see RetryPolicy
 */
final class RedisCommandExecutor {
  private static final Logger log = LoggerFactory.getLogger(RedisCommandExecutor.class);

  static final int DEFAULT_MAX_RETRIES = 2;
  static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(50);

  private final RetryPolicy<Object> transientFailureRetry;

  RedisCommandExecutor(int maxRetries, Duration retryDelay) {
    checkArgument(maxRetries >= 0, "maxRetries cannot be negative: %s", maxRetries);
    checkNotNull(retryDelay, "retryDelay cannot be null");
    this.transientFailureRetry =
        RetryPolicy.builder()
            .handle(RedisConnectionFailureException.class, QueryTimeoutException.class)
            .withMaxRetries(maxRetries)
            .withDelay(retryDelay)
            .onRetry(
                event ->
                    log.debug(
                        "Retrying Redis command, attempt {}",
                        event.getAttemptCount() + 1,
                        event.getLastException()))
            .build();
  }

  <R> Result<R> execute(String command, String key, boolean idempotent, Supplier<R> block) {
    try {
      R reply = idempotent ? Failsafe.with(transientFailureRetry).get(block::get) : block.get();
      if (reply == null) {
        // Spring returns null for commands queued in a pipeline or a transaction.
        return new Result.Failure<>(
            new KeyValueStoreException(key, "Redis " + command + " returned no reply for " + key));
      }
      return new Result.Success<>(reply);
    } catch (DataAccessException e) {
      return new Result.Failure<>(
          new KeyValueStoreException(key, "Redis " + command + " failed for " + key, e));
    } catch (FailsafeException e) {
      return new Result.Failure<>(
          new KeyValueStoreException(
              key, "Redis " + command + " failed for " + key, e.getCause()));
    }
  }
}
