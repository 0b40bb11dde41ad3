package latchkey.api.store;

/**
 * A {@link KeyValueStore} able to create a key and its expiration in one atomic operation.
 *
 * <p>With a plain store, a mutex applies its TTL with a second {@link #expire(String, long)} call
 * after {@link #setIfAbsent(String, String)}. A process dying between the two calls leaves a key
 * that never expires. Stores implementing this interface close that window.
 */
public interface ExpiringKeyValueStore extends KeyValueStore {

  /**
   * Sets {@code key} to {@code value} with a time to live of {@code ttlSeconds}, only when {@code
   * key} does not exist.
   *
   * @return whether the value was written
   */
  boolean setIfAbsent(String key, String value, long ttlSeconds);
}
