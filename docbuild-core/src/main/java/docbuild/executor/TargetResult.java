package docbuild.executor;

import java.util.Objects;

/**
 * Result of building documentation for one target.
 *
 * @param documentedItems documented public items, {@code null} if not measured
 * @param totalItems      total public items, {@code null} if not measured
 */
public record TargetResult(
    String target,
    boolean successful,
    boolean docsProduced,
    int exitCode,
    boolean timedOut,
    boolean memoryExceeded,
    Integer documentedItems,
    Integer totalItems
) {

  public TargetResult {
    Objects.requireNonNull(target, "target");
  }

  public static TargetResult timedOut(String target) {
    return new TargetResult(target, false, false, -1, true, false, null, null);
  }
}
