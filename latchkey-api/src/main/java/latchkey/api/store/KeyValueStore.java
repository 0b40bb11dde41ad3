package latchkey.api.store;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;

import java.util.Optional;

/**
 * The minimal set of atomic operations a mutex needs from a shared key-value store.
 *
 * <p>Implementations must be safe for concurrent use from several threads, and every operation
 * must be atomic at the store. {@link #setIfAbsent(String, String)} is the only serialization
 * point between competing processes, so a store that cannot guarantee its atomicity cannot back
 * a mutex.
 *
 * <p>Any failure to reach the store or to complete an operation is reported as a {@link
 * KeyValueStoreException}, never as a {@code false} or empty result.
 */
@ThreadSafe
public interface KeyValueStore {

  /**
   * Sets {@code key} to {@code value} only when {@code key} does not exist.
   *
   * @return whether the value was written
   */
  boolean setIfAbsent(String key, String value);

  /**
   * @return the value stored under {@code key}, or empty when the key does not exist
   */
  Optional<String> get(String key);

  /**
   * Sets a time to live on an existing key.
   *
   * @return {@code false} when the key did not exist, for example because it expired or was
   *     deleted concurrently
   */
  @CanIgnoreReturnValue
  boolean expire(String key, long ttlSeconds);

  /** Removes {@code key}. Removing a missing key is not an error. */
  void delete(String key);

  boolean exists(String key);
}
