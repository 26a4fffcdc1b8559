package docbuild.registry;

/**
 * Read-only access to the external registry index.
 *
 * <p>A reference is an opaque token identifying one state of the index (a
 * commit id, a sequence number, ...). Implementations must be able to diff
 * any reference they previously returned against the current state without
 * scanning every package.
 *
 * <p>All methods throw {@link RegistryIndexException} when the index cannot be
 * reached; callers treat that as transient.
 */
public interface RegistryIndex {

  /**
   * Returns the reference of the current index state.
   */
  String headReference();

  /**
   * Returns the changes between {@code reference} and the current state.
   *
   * @param reference a reference previously returned by this index
   * @return the ordered changes and the reference they lead to
   */
  IndexDiff changesSince(String reference);

  /**
   * Lists every release currently in the index. Expensive; used only by the
   * consistency check.
   *
   * @throws UnsupportedOperationException if the index cannot enumerate itself
   */
  default IndexSnapshot snapshot() {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support snapshots");
  }
}
