package docbuild.registry;

import java.util.List;
import java.util.Objects;

/**
 * Changes between two index references, oldest first.
 */
public record IndexDiff(List<IndexChange> changes, String reference) {

  public IndexDiff {
    Objects.requireNonNull(reference, "reference");
    changes = changes == null ? List.of() : List.copyOf(changes);
  }
}
