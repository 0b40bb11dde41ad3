package latchkey.client;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.ThreadSafe;
import latchkey.api.LatchkeyException;
import latchkey.api.lock.Mutex;
import latchkey.api.lock.MutexGuard;
import latchkey.api.store.KeyValueStore;
import latchkey.core.internal.lock.DefaultMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point handing out {@link Mutex} handles over one shared {@link KeyValueStore}.
 *
 * <p>The client keeps one handle per lock name and TTL, so repeated {@link #getMutex} calls
 * return the same handle until it is closed. On normal JVM termination a shutdown hook closes the
 * remaining handles, releasing their locks. A killed JVM runs no hook, so locks that must not
 * outlive a crash need a TTL.
 *
 * <p>Closing a handle releases its lock whether or not that handle acquired it. Prefer a {@link
 * MutexGuard}, which releases only an acquisition it made.
 *
 * <pre>{@code
 * try (LatchkeyClient client = new LatchkeyClient(RedisKeyValueStore.create("localhost", 6379))) {
 *   Mutex mutex = client.getMutex("nightly-export", Duration.ofMinutes(20));
 *   Optional<MutexGuard> acquired = mutex.acquire(Duration.ofSeconds(5));
 *   if (acquired.isPresent()) {
 *     try (MutexGuard guard = acquired.get()) {
 *       // critical section
 *     }
 *   }
 * }
 * }</pre>
 */
@ThreadSafe
public class LatchkeyClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LatchkeyClient.class);

  private final KeyValueStore store;
  private final Clock clock;
  private final ConcurrentMap<HandleKey, Mutex> openMutexes = Maps.newConcurrentMap();
  private final Thread shutdownHook;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public LatchkeyClient(KeyValueStore store) {
    this(store, Clock.systemUTC());
  }

  public LatchkeyClient(KeyValueStore store, Clock clock) {
    this.store = checkNotNull(store, "store cannot be null");
    this.clock = checkNotNull(clock, "clock cannot be null");
    this.shutdownHook = new Thread(this::closeOpenMutexes, "latchkey-shutdown-release");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
  }

  /** A handle on a lock that never expires. */
  public Mutex getMutex(String name) {
    return getMutex(name, Duration.ZERO);
  }

  /**
   * Returns the open handle for this name and TTL, creating it on first use. Handles with the same
   * name address the same lock whatever their TTL.
   *
   * @param maxTtl age in whole seconds after which the lock counts as abandoned, {@link
   *     Duration#ZERO} for a lock that never expires
   */
  public Mutex getMutex(String name, Duration maxTtl) {
    checkState(!closed.get(), "LatchkeyClient is closed");
    return openMutexes.computeIfAbsent(
        new HandleKey(name, maxTtl),
        handle -> new DefaultMutex(name, maxTtl, store, clock, this::forget));
  }

  private void forget(Mutex mutex) {
    openMutexes.remove(new HandleKey(mutex.getName(), mutex.getMaxTtl()), mutex);
  }

  @VisibleForTesting
  Set<Mutex> getOpenMutexes() {
    return ImmutableSet.copyOf(openMutexes.values());
  }

  @VisibleForTesting
  Thread getShutdownHook() {
    return shutdownHook;
  }

  @VisibleForTesting
  void closeOpenMutexes() {
    for (Mutex mutex : ImmutableSet.copyOf(openMutexes.values())) {
      log.debug("Releasing {} on client shutdown", mutex.getKey());
      mutex.close();
    }
  }

  /**
   * Closes every open handle, then the store when it is {@link AutoCloseable}.
   *
   * @throws LatchkeyException when the store fails to close
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      // The JVM is already shutting down and runs the hook itself.
      log.debug("Shutdown in progress, leaving release to the shutdown hook");
      return;
    }
    closeOpenMutexes();
    if (store instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw new LatchkeyException("Failed to close key-value store", e);
      }
    }
  }

  private record HandleKey(String name, Duration maxTtl) {}
}
