package docbuild.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Sparse per-package override of sandbox limits. Absent values fall back to
 * the global defaults.
 */
public record SandboxPolicy(String packageName, Long memoryBytes, Duration timeout, Integer maxTargets) {

  public SandboxPolicy {
    Objects.requireNonNull(packageName, "packageName");
    packageName = PackageNames.normalize(packageName);
    if (memoryBytes != null && memoryBytes <= 0) {
      throw new IllegalArgumentException("memoryBytes must be > 0");
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (maxTargets != null && maxTargets < 1) {
      throw new IllegalArgumentException("maxTargets must be >= 1");
    }
  }

  public boolean isEmpty() {
    return memoryBytes == null && timeout == null && maxTargets == null;
  }
}
