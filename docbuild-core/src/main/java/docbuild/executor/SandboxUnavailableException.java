package docbuild.executor;

/**
 * Thrown when the sandbox infrastructure cannot run a build at all, for example
 * because the container runtime is down. Callers treat it as transient: the
 * queue entry is released without consuming an attempt.
 */
public class SandboxUnavailableException extends RuntimeException {

  public SandboxUnavailableException(String message) {
    super(message);
  }

  public SandboxUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
