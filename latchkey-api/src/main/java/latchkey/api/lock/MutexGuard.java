package latchkey.api.lock;

/**
 * Proof of a successful acquisition, released when closed.
 *
 * <p>Intended for try-with-resources so the lock is released on every exit path:
 *
 * <pre>{@code
 * Optional<MutexGuard> guard = mutex.acquire(Duration.ofSeconds(5));
 * if (guard.isPresent()) {
 *   try (MutexGuard held = guard.get()) {
 *     // critical section
 *   }
 * }
 * }</pre>
 */
public interface MutexGuard extends AutoCloseable {

  Mutex getMutex();

  /**
   * @return whether {@link #close()} has already released this acquisition
   */
  boolean isReleased();

  /** Releases the lock. Only the first call reaches the store. */
  @Override
  void close();
}
