package latchkey.core.internal.lock;

import com.google.common.base.MoreObjects;
import latchkey.api.lock.Mutex;
import latchkey.api.lock.MutexGuard;

import java.util.concurrent.atomic.AtomicBoolean;

final class DefaultMutexGuard implements MutexGuard {
  private final Mutex mutex;
  private final AtomicBoolean released = new AtomicBoolean(false);

  DefaultMutexGuard(Mutex mutex) {
    this.mutex = mutex;
  }

  @Override
  public Mutex getMutex() {
    return mutex;
  }

  @Override
  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      mutex.unlock();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", mutex.getKey())
        .add("released", released.get())
        .toString();
  }
}
