package docbuild.executor;

import docbuild.model.SandboxPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Resource limits applied to one build.
 *
 * @param memoryBytes  hard memory limit of the sandbox
 * @param timeout      wall-clock budget for the whole build, across all targets
 * @param maxTargets   maximum number of targets built, default target included
 * @param networking   whether the sandbox may reach the network
 * @param maxLogBytes  cap on the stored build log
 */
public record SandboxLimits(long memoryBytes, Duration timeout, int maxTargets, boolean networking, long maxLogBytes) {

  public static final SandboxLimits DEFAULTS = new SandboxLimits(
      3L * 1024 * 1024 * 1024,
      Duration.ofMinutes(15),
      10,
      false,
      5L * 1024 * 1024);

  public SandboxLimits {
    Objects.requireNonNull(timeout, "timeout");
    if (memoryBytes <= 0) {
      throw new IllegalArgumentException("memoryBytes must be > 0");
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (maxTargets < 1) {
      throw new IllegalArgumentException("maxTargets must be >= 1");
    }
    if (maxLogBytes <= 0) {
      throw new IllegalArgumentException("maxLogBytes must be > 0");
    }
  }

  /**
   * Overlays a per-package policy on {@code defaults}.
   *
   * <ul>
   *   <li>a memory override only ever raises the limit;</li>
   *   <li>a timeout override without a target override limits the build to one target;</li>
   *   <li>networking and log cap always come from {@code defaults}.</li>
   * </ul>
   *
   * @param policy may be {@code null}
   */
  public static SandboxLimits resolve(SandboxLimits defaults, SandboxPolicy policy) {
    Objects.requireNonNull(defaults, "defaults");
    if (policy == null || policy.isEmpty()) {
      return defaults;
    }
    long memory = policy.memoryBytes() != null
        ? Math.max(defaults.memoryBytes(), policy.memoryBytes())
        : defaults.memoryBytes();
    Duration timeout = policy.timeout() != null ? policy.timeout() : defaults.timeout();
    int maxTargets;
    if (policy.maxTargets() != null) {
      maxTargets = policy.maxTargets();
    } else if (policy.timeout() != null) {
      maxTargets = 1;
    } else {
      maxTargets = defaults.maxTargets();
    }
    return new SandboxLimits(memory, timeout, maxTargets, defaults.networking(), defaults.maxLogBytes());
  }
}
