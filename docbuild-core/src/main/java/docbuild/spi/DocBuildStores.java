package docbuild.spi;

import java.util.Objects;

/**
 * The full set of persistence backends used by the docbuild components.
 * Implementations are usually obtained from a single database dialect.
 */
public record DocBuildStores(
    QueueStore queue,
    ReleaseStore releases,
    BuildStore builds,
    ReleaseStatusStore statuses,
    CheckpointStore checkpoints,
    ServiceConfigStore serviceConfig,
    BlacklistStore blacklist,
    PriorityRuleStore priorityRules,
    SandboxPolicyStore sandboxPolicies
) {

  public DocBuildStores {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(releases, "releases");
    Objects.requireNonNull(builds, "builds");
    Objects.requireNonNull(statuses, "statuses");
    Objects.requireNonNull(checkpoints, "checkpoints");
    Objects.requireNonNull(serviceConfig, "serviceConfig");
    Objects.requireNonNull(blacklist, "blacklist");
    Objects.requireNonNull(priorityRules, "priorityRules");
    Objects.requireNonNull(sandboxPolicies, "sandboxPolicies");
  }
}
