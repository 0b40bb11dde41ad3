package latchkey.api.lock;

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import latchkey.api.Resourceful;

import java.time.Duration;
import java.util.Optional;

/**
 * A named lock shared by every process that reaches the same store.
 *
 * <p>Ownership lives in the store only: a lock is held while its key exists there. A handle keeps
 * no local view of the lock state, so two handles with the same name behave exactly like two
 * processes. The lock is neither reentrant nor fair, and waiters are not served in arrival order.
 *
 * <p>There is no ownership token. {@link #unlock()} deletes the key whoever set it, so callers
 * must only unlock what they acquired.
 *
 * <p>All methods propagate {@link latchkey.api.store.KeyValueStoreException} when the store fails.
 */
@ThreadSafe
public interface Mutex extends Resourceful {

  Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);

  /** Waits forever when passed as a timeout. */
  Duration NO_TIMEOUT = Duration.ZERO;

  /**
   * @return the age after which a held lock counts as abandoned, {@link Duration#ZERO} when the
   *     lock never expires
   */
  Duration getMaxTtl();

  /**
   * Makes a single, non-blocking attempt to acquire the lock.
   *
   * <p>With a TTL configured, a failed attempt may still change the store: a lock older than its
   * TTL is deleted and acquisition is retried once.
   *
   * @return whether the caller now holds the lock
   */
  @CheckReturnValue
  boolean tryLock();

  /** Waits for the lock without a timeout. Always returns {@code true}. */
  default boolean lock() throws InterruptedException {
    return lock(NO_TIMEOUT, DEFAULT_POLL_INTERVAL);
  }

  default boolean lock(Duration timeout) throws InterruptedException {
    return lock(timeout, DEFAULT_POLL_INTERVAL);
  }

  /**
   * Polls {@link #tryLock()} every {@code pollInterval} until it succeeds or {@code timeout}
   * elapses.
   *
   * @param timeout how long to wait, {@link #NO_TIMEOUT} to wait forever
   * @param pollInterval the pause between two attempts
   * @return {@code true} once acquired, {@code false} only when the timeout elapsed
   * @throws InterruptedException if the thread is interrupted while waiting; the lock is not held
   */
  boolean lock(Duration timeout, Duration pollInterval) throws InterruptedException;

  /**
   * Releases the lock by deleting its key.
   *
   * <p>Never checks who holds the lock and never fails on a lock that is not held.
   */
  void unlock();

  /**
   * Reports whether the lock key currently exists. Read only.
   *
   * <p>For monitoring only. Never use it to decide whether to enter a critical section: the check
   * and any later acquisition are not atomic together, and another process can take the lock in
   * between. This is wrong:
   *
   * <pre>{@code
   * if (!mutex.isLocked()) {
   *   mutex.tryLock();
   *   // critical section
   * }
   * }</pre>
   *
   * Use {@link #tryLock()} or {@link #lock()} and check their result instead.
   */
  boolean isLocked();

  /** {@link #tryLock()} returning a guard that releases the lock when closed. */
  Optional<MutexGuard> tryAcquire();

  default Optional<MutexGuard> acquire(Duration timeout) throws InterruptedException {
    return acquire(timeout, DEFAULT_POLL_INTERVAL);
  }

  /** {@link #lock(Duration, Duration)} returning a guard that releases the lock when closed. */
  Optional<MutexGuard> acquire(Duration timeout, Duration pollInterval)
      throws InterruptedException;

  /**
   * Best-effort {@link #unlock()} when the handle is discarded. Store failures are logged, not
   * thrown. Only the first call reaches the store.
   *
   * <p>Like {@link #unlock()} this releases the lock even if this handle never acquired it.
   */
  @Override
  void close();
}
