package docbuild.model;

import java.util.List;

/**
 * Registry-provided facts about a release, captured at synchronization time.
 *
 * @param library      {@code null} when the registry does not say whether the
 *                     package has a library target
 * @param dependencies opaque JSON describing declared dependencies, may be {@code null}
 * @param targets      build targets requested by the package, may be empty
 */
public record ReleaseMetadata(boolean yanked, Boolean library, String dependencies, List<String> targets) {

  public static final ReleaseMetadata UNKNOWN = new ReleaseMetadata(false, null, null, List.of());

  public ReleaseMetadata {
    targets = targets == null ? List.of() : List.copyOf(targets);
  }
}
