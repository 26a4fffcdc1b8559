package docbuild.executor;

import java.time.Duration;

/**
 * Isolated environment that builds documentation.
 *
 * <p>{@link #prepare} runs before a build attempt is recorded; a
 * {@link SandboxUnavailableException} thrown there leaves no trace. Failures
 * from the later methods are recorded on the attempt.
 */
public interface Sandbox {

  /** Version string of the documentation toolchain, stored on every attempt. */
  String toolchainVersion();

  /**
   * Verifies the sandbox can run {@code request} and sets up its working area.
   *
   * @throws SandboxUnavailableException if the infrastructure is not usable
   */
  void prepare(BuildRequest request, SandboxLimits limits);

  /**
   * Determines whether the package is a library and which targets it requests.
   */
  PackageMetadata inspect(BuildRequest request, SandboxLimits limits, BuildLog log);

  /**
   * Builds documentation for one target. Implementations must stop the run
   * once {@code budget} has elapsed and report it as timed out.
   */
  TargetResult build(BuildRequest request, String target, SandboxLimits limits, Duration budget, BuildLog log);

  /** Removes the working area of {@code request}. Called after every attempt. */
  default void cleanup(BuildRequest request) {
  }
}
