package latchkey.core.internal.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** Maps mutex names onto store keys. */
public final class MutexKeys {

  /** Shared with existing deployments so every client of a store addresses the same key. */
  public static final String KEY_PREFIX = "//mutex/";

  private MutexKeys() {}

  public static String keyOf(String name) {
    checkNotNull(name, "Mutex name cannot be null");
    checkArgument(!name.isEmpty(), "Mutex name cannot be empty");
    return KEY_PREFIX + name;
  }
}
