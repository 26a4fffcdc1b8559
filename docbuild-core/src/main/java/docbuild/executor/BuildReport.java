package docbuild.executor;

import docbuild.model.BuildStatus;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one {@link SandboxExecutor#execute} call.
 *
 * @param targets results of the targets that ran, default target first
 */
public record BuildReport(
    long buildId,
    long releaseId,
    BuildStatus status,
    String toolchainVersion,
    List<TargetResult> targets,
    boolean timedOut,
    boolean memoryExceeded,
    Duration duration
) {

  public BuildReport {
    targets = targets == null ? List.of() : List.copyOf(targets);
  }

  public boolean successful() {
    return status == BuildStatus.SUCCESS;
  }
}
