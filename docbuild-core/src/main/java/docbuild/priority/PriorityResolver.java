package docbuild.priority;

import docbuild.model.PriorityRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assigns a build priority to a candidate release.
 *
 * <p>A release that did not exist before the current sync always gets
 * {@link Priorities#NEW_RELEASE}, whatever rules match. Otherwise the first
 * rule whose pattern matches the package name wins, falling back to the
 * baseline priority.
 *
 * <p>Instances are immutable and hold a snapshot of the rules they were built from.
 */
public final class PriorityResolver {
  private final List<CompiledRule> rules;
  private final int baseline;

  public PriorityResolver(List<PriorityRule> rules) {
    this(rules, Priorities.DEFAULT);
  }

  public PriorityResolver(List<PriorityRule> rules, int baseline) {
    Objects.requireNonNull(rules, "rules");
    List<CompiledRule> compiled = new ArrayList<>(rules.size());
    for (PriorityRule rule : rules) {
      compiled.add(new CompiledRule(LikePattern.compile(rule.pattern()), rule.priority()));
    }
    this.rules = List.copyOf(compiled);
    this.baseline = baseline;
  }

  /**
   * Resolves the priority of a candidate.
   *
   * @param name       package name
   * @param newRelease {@code true} if the release was unknown before this sync
   */
  public int resolve(String name, boolean newRelease) {
    if (newRelease) {
      return Priorities.NEW_RELEASE;
    }
    return ruleFor(name);
  }

  /**
   * Priority from the rules alone, ignoring novelty. Used for manual enqueues
   * that carry no explicit priority.
   */
  public int ruleFor(String name) {
    Objects.requireNonNull(name, "name");
    for (CompiledRule rule : rules) {
      if (rule.pattern().matches(name)) {
        return rule.priority();
      }
    }
    return baseline;
  }

  private record CompiledRule(LikePattern pattern, int priority) {}
}
