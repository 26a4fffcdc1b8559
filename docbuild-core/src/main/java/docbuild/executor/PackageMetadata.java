package docbuild.executor;

import java.util.List;
import java.util.Objects;

/**
 * What the sandbox learned about a package before building it.
 *
 * @param library       whether the package has a library target
 * @param defaultTarget target built first and used to judge success
 * @param targets       other targets the package asks to be built for, in order
 */
public record PackageMetadata(boolean library, String defaultTarget, List<String> targets) {

  public PackageMetadata {
    Objects.requireNonNull(defaultTarget, "defaultTarget");
    targets = targets == null ? List.of() : List.copyOf(targets);
  }
}
