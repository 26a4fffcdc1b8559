package docbuild.registry;

import java.util.List;
import java.util.Objects;

/**
 * Every release present in the index at one reference.
 */
public record IndexSnapshot(String reference, List<Entry> releases) {

  public IndexSnapshot {
    Objects.requireNonNull(reference, "reference");
    releases = releases == null ? List.of() : List.copyOf(releases);
  }

  public record Entry(String name, String version, boolean yanked) {}
}
