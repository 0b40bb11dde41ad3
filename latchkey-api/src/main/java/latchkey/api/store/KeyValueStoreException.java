package latchkey.api.store;

import latchkey.api.LatchkeyException;

/**
 * Raised when the coordination store cannot be reached or rejects an operation.
 *
 * <p>Callers use this to tell "the store is down" apart from "someone else holds the lock",
 * which is always reported as a {@code false} result rather than an exception.
 */
public class KeyValueStoreException extends LatchkeyException {

  private final String key;

  public KeyValueStoreException(String key, String message, Throwable cause) {
    super(message, cause);
    this.key = key;
  }

  public KeyValueStoreException(String key, String message) {
    super(message);
    this.key = key;
  }

  /**
   * @return the store key the failed operation addressed
   */
  public String getKey() {
    return key;
  }
}
