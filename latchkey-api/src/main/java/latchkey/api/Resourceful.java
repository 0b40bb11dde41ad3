package latchkey.api;

/** A named coordination primitive backed by a shared store. */
public interface Resourceful extends AutoCloseable {

  /**
   * @return the name that identifies this primitive across processes
   */
  String getName();

  /**
   * @return the store key this primitive reads and writes
   */
  String getKey();
}
