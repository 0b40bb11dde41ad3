package latchkey.core.internal.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.Longs;
import com.google.errorprone.annotations.ThreadSafe;
import latchkey.api.LatchkeyException;
import latchkey.api.lock.Mutex;
import latchkey.api.lock.MutexGuard;
import latchkey.api.store.ExpiringKeyValueStore;
import latchkey.api.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link Mutex} implemented with set-if-absent on a {@link KeyValueStore}.
 *
 * <p>The lock record is the key {@code //mutex/<name>} holding the acquisition time in epoch
 * seconds. The acquisition protocol of {@link #tryLock()} is:
 *
 * <ol>
 *   <li>Set the key to the current time if it is absent. Success makes the caller the holder.
 *   <li>Without a TTL, that result is final.
 *   <li>With a TTL, after a successful set, apply the TTL to the key. If the key vanished before
 *       the TTL could be applied, delete it and report failure so no key is left without
 *       expiration.
 *   <li>With a TTL, after a failed set, read the stored time. A missing or unreadable value, or
 *       one older than the TTL, marks an abandoned lock: delete it and retry the set once. The
 *       retried set gets no TTL.
 * </ol>
 *
 * <p>When the store is an {@link ExpiringKeyValueStore}, steps 1 and 3 collapse into a single
 * atomic set-if-absent with expiration.
 *
 * <p>The handle keeps no view of the lock state; its only mutable field records whether it was
 * closed. One instance may be shared between threads, which gives those threads no mutual
 * exclusion beyond what the store provides.
 */
@ThreadSafe
public class DefaultMutex implements Mutex {
  private static final Logger log = LoggerFactory.getLogger(DefaultMutex.class);

  private final String name;
  private final String key;
  private final long maxTtlSeconds;
  private final KeyValueStore store;
  private final Clock clock;
  private final Consumer<Mutex> onCloseListener;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public DefaultMutex(String name, KeyValueStore store) {
    this(name, Duration.ZERO, store, Clock.systemUTC());
  }

  public DefaultMutex(String name, Duration maxTtl, KeyValueStore store) {
    this(name, maxTtl, store, Clock.systemUTC());
  }

  /**
   * @param name identifies the lock across every process using {@code store}
   * @param maxTtl age in whole seconds after which a held lock counts as abandoned, {@link
   *     Duration#ZERO} for a lock that never expires
   * @param store the shared store holding the lock record
   * @param clock source of acquisition timestamps
   */
  public DefaultMutex(String name, Duration maxTtl, KeyValueStore store, Clock clock) {
    this(name, maxTtl, store, clock, mutex -> {});
  }

  /**
   * @param onCloseListener notified once, after the first {@link #close()} released the lock
   */
  public DefaultMutex(
      String name,
      Duration maxTtl,
      KeyValueStore store,
      Clock clock,
      Consumer<Mutex> onCloseListener) {
    this.key = MutexKeys.keyOf(name);
    this.name = name;
    checkNotNull(maxTtl, "maxTtl cannot be null");
    checkArgument(!maxTtl.isNegative(), "maxTtl cannot be negative: %s", maxTtl);
    checkArgument(maxTtl.getNano() == 0, "maxTtl must be a whole number of seconds: %s", maxTtl);
    this.maxTtlSeconds = maxTtl.getSeconds();
    this.store = checkNotNull(store, "store cannot be null");
    this.clock = checkNotNull(clock, "clock cannot be null");
    this.onCloseListener = checkNotNull(onCloseListener, "onCloseListener cannot be null");
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getKey() {
    return key;
  }

  @Override
  public Duration getMaxTtl() {
    return Duration.ofSeconds(maxTtlSeconds);
  }

  @Override
  public boolean tryLock() {
    if (maxTtlSeconds == 0) {
      return store.setIfAbsent(key, now());
    }

    if (store instanceof ExpiringKeyValueStore expiring) {
      if (expiring.setIfAbsent(key, now(), maxTtlSeconds)) {
        return true;
      }
    } else if (store.setIfAbsent(key, now())) {
      return applyTtl();
    }

    return reclaimIfAbandoned();
  }

  private boolean applyTtl() {
    if (store.expire(key, maxTtlSeconds)) {
      return true;
    }
    // Lost the key between set and expire. Never leave a key without expiration behind.
    log.debug("{} vanished before its ttl was applied", key);
    store.delete(key);
    return false;
  }

  private boolean reclaimIfAbandoned() {
    Optional<String> stored = store.get(key);
    if (stored.isPresent() && !isAbandoned(stored.get())) {
      return false;
    }

    log.debug(
        "Reclaiming {} past its {}s ttl (stored time: {})",
        key,
        maxTtlSeconds,
        stored.orElse("<gone>"));
    store.delete(key);
    return store.setIfAbsent(key, now());
  }

  private boolean isAbandoned(String storedTime) {
    Long lockedAt = Longs.tryParse(storedTime);
    return lockedAt == null || clock.instant().getEpochSecond() - lockedAt > maxTtlSeconds;
  }

  @Override
  public boolean lock(Duration timeout, Duration pollInterval) throws InterruptedException {
    checkNotNull(timeout, "timeout cannot be null");
    checkNotNull(pollInterval, "pollInterval cannot be null");
    checkArgument(!timeout.isNegative(), "timeout cannot be negative: %s", timeout);
    checkArgument(!pollInterval.isNegative(), "pollInterval cannot be negative: %s", pollInterval);

    final boolean timed = !timeout.isZero();
    final long timeoutNanos = timed ? timeout.toNanos() : 0L;
    final long start = System.nanoTime();

    while (!tryLock()) {
      if (timed && System.nanoTime() - start > timeoutNanos) {
        log.debug("Gave up waiting for {} after {}", key, timeout);
        return false;
      }
      TimeUnit.NANOSECONDS.sleep(pollInterval.toNanos());
    }
    return true;
  }

  @Override
  public void unlock() {
    store.delete(key);
  }

  @Override
  public boolean isLocked() {
    return store.exists(key);
  }

  @Override
  public Optional<MutexGuard> tryAcquire() {
    return tryLock() ? Optional.of(new DefaultMutexGuard(this)) : Optional.empty();
  }

  @Override
  public Optional<MutexGuard> acquire(Duration timeout, Duration pollInterval)
      throws InterruptedException {
    return lock(timeout, pollInterval)
        ? Optional.of(new DefaultMutexGuard(this))
        : Optional.empty();
  }

  /** Only the first call releases the lock. Later calls do nothing. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      unlock();
    } catch (LatchkeyException e) {
      log.warn("Failed to release {} on close, it is left to its ttl", key, e);
    } finally {
      onCloseListener.accept(this);
    }
  }

  private String now() {
    return Long.toString(clock.instant().getEpochSecond());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("key", key)
        .add("maxTtlSeconds", maxTtlSeconds)
        .toString();
  }
}
