package docbuild.model;

import java.util.List;

/**
 * What a finished build contributes back to its release row.
 */
public record BuildOutputs(
    boolean library,
    String defaultTarget,
    List<String> docTargets,
    boolean hasDocs,
    Integer documentedItems,
    Integer totalItems
) {

  public BuildOutputs {
    docTargets = docTargets == null ? List.of() : List.copyOf(docTargets);
  }
}
