package latchkey.storage.redis;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import latchkey.api.store.ExpiringKeyValueStore;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link ExpiringKeyValueStore} on Redis.
 *
 * <table>
 *   <caption>Command mapping</caption>
 *   <tr><td>{@code setIfAbsent(k, v)}</td><td>{@code SETNX k v}</td></tr>
 *   <tr><td>{@code setIfAbsent(k, v, ttl)}</td><td>{@code SET k v NX EX ttl}</td></tr>
 *   <tr><td>{@code get(k)}</td><td>{@code GET k}</td></tr>
 *   <tr><td>{@code expire(k, ttl)}</td><td>{@code EXPIRE k ttl}</td></tr>
 *   <tr><td>{@code delete(k)}</td><td>{@code DEL k}</td></tr>
 *   <tr><td>{@code exists(k)}</td><td>{@code EXISTS k}</td></tr>
 * </table>
 *
 * <p>Point it at the master of a replicated deployment: replicas acknowledge writes
 * asynchronously, so two clients could both win {@code SETNX} across a failover.
 */
@ThreadSafe
public class RedisKeyValueStore implements ExpiringKeyValueStore, AutoCloseable {

  private final StringRedisTemplate template;
  private final RedisCommandExecutor executor;

  // Only set when this store created the connection factory and therefore owns it.
  private final LettuceConnectionFactory ownedConnectionFactory;

  public RedisKeyValueStore(StringRedisTemplate template) {
    this(
        template,
        RedisCommandExecutor.DEFAULT_MAX_RETRIES,
        RedisCommandExecutor.DEFAULT_RETRY_DELAY);
  }

  /**
   * @param template the Redis connection to use, left open by {@link #close()}
   * @param maxRetries how often an idempotent command is retried after a connection failure
   * @param retryDelay the pause before each retry
   */
  public RedisKeyValueStore(StringRedisTemplate template, int maxRetries, Duration retryDelay) {
    this(template, new RedisCommandExecutor(maxRetries, retryDelay), null);
  }

  @VisibleForTesting
  RedisKeyValueStore(
      StringRedisTemplate template,
      RedisCommandExecutor executor,
      LettuceConnectionFactory ownedConnectionFactory) {
    this.template = checkNotNull(template, "template cannot be null");
    this.executor = executor;
    this.ownedConnectionFactory = ownedConnectionFactory;
  }

  /** Connects to a standalone Redis server through Lettuce. {@link #close()} disconnects. */
  public static RedisKeyValueStore create(String host, int port) {
    return create(new RedisStandaloneConfiguration(host, port));
  }

  public static RedisKeyValueStore create(RedisStandaloneConfiguration configuration) {
    LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(configuration);
    connectionFactory.afterPropertiesSet();
    connectionFactory.start();
    return new RedisKeyValueStore(
        new StringRedisTemplate(connectionFactory),
        new RedisCommandExecutor(
            RedisCommandExecutor.DEFAULT_MAX_RETRIES, RedisCommandExecutor.DEFAULT_RETRY_DELAY),
        connectionFactory);
  }

  @Override
  public boolean setIfAbsent(String key, String value) {
    return executor
        .execute("SETNX", key, false, () -> template.opsForValue().setIfAbsent(key, value))
        .getOrThrow();
  }

  @Override
  public boolean setIfAbsent(String key, String value, long ttlSeconds) {
    return executor
        .execute(
            "SET NX EX",
            key,
            false,
            () -> template.opsForValue().setIfAbsent(key, value, Duration.ofSeconds(ttlSeconds)))
        .getOrThrow();
  }

  @Override
  public Optional<String> get(String key) {
    return executor
        .execute("GET", key, true, () -> Optional.ofNullable(template.opsForValue().get(key)))
        .getOrThrow();
  }

  @Override
  public boolean expire(String key, long ttlSeconds) {
    return executor
        .execute("EXPIRE", key, true, () -> template.expire(key, Duration.ofSeconds(ttlSeconds)))
        .getOrThrow();
  }

  @Override
  public void delete(String key) {
    executor.execute("DEL", key, true, () -> template.delete(key)).getOrThrow();
  }

  @Override
  public boolean exists(String key) {
    return executor.execute("EXISTS", key, true, () -> template.hasKey(key)).getOrThrow();
  }

  @Override
  public void close() {
    if (ownedConnectionFactory != null) {
      ownedConnectionFactory.destroy();
    }
  }
}
