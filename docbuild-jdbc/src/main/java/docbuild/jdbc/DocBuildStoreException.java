package docbuild.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores.
 */
public final class DocBuildStoreException extends RuntimeException {
  public DocBuildStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
