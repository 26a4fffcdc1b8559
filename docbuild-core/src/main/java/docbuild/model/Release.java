package docbuild.model;

import java.util.List;

/**
 * A versioned publication of a package together with registry metadata and the
 * outputs of its most recent documentation build.
 *
 * @param library {@code null} while the package has not been classified yet
 */
public record Release(
    long id,
    long packageId,
    String name,
    String version,
    boolean yanked,
    Boolean library,
    String dependencies,
    List<String> targets,
    String defaultTarget,
    List<String> docTargets,
    boolean hasDocs,
    Integer documentedItems,
    Integer totalItems
) {

  public Release {
    targets = targets == null ? List.of() : List.copyOf(targets);
    docTargets = docTargets == null ? List.of() : List.copyOf(docTargets);
  }
}
