package latchkey.api;

/**
 * Outcome of a store operation executed under a retry pipeline.
 *
 * @param <T> the value type of a successful outcome
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

  /**
   * @return the value of a success
   * @throws LatchkeyException the cause of a failure
   */
  T getOrThrow();

  record Success<T>(T value) implements Result<T> {
    @Override
    public T getOrThrow() {
      return value;
    }
  }

  record Failure<T>(LatchkeyException cause) implements Result<T> {
    @Override
    public T getOrThrow() {
      throw cause;
    }
  }
}
