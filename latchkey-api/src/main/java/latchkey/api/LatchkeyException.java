package latchkey.api;

/** Root of every unchecked failure raised by latchkey. */
public class LatchkeyException extends RuntimeException {

  public LatchkeyException(String message) {
    super(message);
  }

  public LatchkeyException(String message, Throwable cause) {
    super(message, cause);
  }
}
