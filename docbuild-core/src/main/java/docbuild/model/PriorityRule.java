package docbuild.model;

import java.util.Objects;

/**
 * Maps package names matching a SQL {@code LIKE} pattern to a build priority.
 * Rules are consulted in {@code id} order; the first match wins.
 */
public record PriorityRule(long id, String pattern, int priority) {

  public PriorityRule {
    Objects.requireNonNull(pattern, "pattern");
    if (pattern.isEmpty()) {
      throw new IllegalArgumentException("pattern must not be empty");
    }
  }
}
