package docbuild.registry;

/**
 * The registry index could not be read. Synchronization aborts without
 * advancing its checkpoint and can be retried later.
 */
public class RegistryIndexException extends RuntimeException {

  public RegistryIndexException(String message) {
    super(message);
  }

  public RegistryIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
