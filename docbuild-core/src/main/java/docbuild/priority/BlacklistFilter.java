package docbuild.priority;

import docbuild.model.PackageNames;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drops candidates whose package is blacklisted. Comparison uses normalized names.
 */
public final class BlacklistFilter {
  private final Set<String> blacklisted;

  public BlacklistFilter(Collection<String> names) {
    Objects.requireNonNull(names, "names");
    this.blacklisted = names.stream()
        .map(PackageNames::normalize)
        .collect(Collectors.toUnmodifiableSet());
  }

  public boolean isBlacklisted(String name) {
    return blacklisted.contains(PackageNames.normalize(name));
  }

  /**
   * Returns the candidates that may be built, preserving order.
   *
   * @param nameOf extracts the package name from a candidate
   */
  public <T> List<T> allowed(List<T> candidates, Function<T, String> nameOf) {
    return candidates.stream()
        .filter(c -> !isBlacklisted(nameOf.apply(c)))
        .toList();
  }
}
