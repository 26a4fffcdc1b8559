package docbuild.registry;

import docbuild.model.PackageNames;
import docbuild.model.SyncCheckpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes what changed in the registry index since a checkpoint.
 *
 * <p>Reading is side-effect free and may run concurrently on any number of
 * instances. When several changes touch the same release, only the last one
 * is kept, so the change set always reflects the final index state.
 */
public final class RegistrySnapshotReader {
  private final RegistryIndex index;

  public RegistrySnapshotReader(RegistryIndex index) {
    this.index = Objects.requireNonNull(index, "index");
  }

  /**
   * Reads the changes since {@code checkpoint}. Without a checkpoint the index
   * head is adopted as the new baseline and nothing is replayed.
   *
   * @throws RegistryIndexException if the index is unreachable
   */
  public ChangeSet read(Optional<SyncCheckpoint> checkpoint) {
    String from = checkpoint.map(SyncCheckpoint::reference).orElse(null);
    if (from == null) {
      return ChangeSet.rebaseline(index.headReference());
    }
    IndexDiff diff = index.changesSince(from);
    return partition(from, diff);
  }

  private static ChangeSet partition(String from, IndexDiff diff) {
    Map<String, IndexChange> added = new LinkedHashMap<>();
    Map<String, IndexChange> yanks = new LinkedHashMap<>();
    Map<String, IndexChange> deletions = new LinkedHashMap<>();

    for (IndexChange change : diff.changes()) {
      String key = key(change);
      switch (change.kind()) {
        case RELEASE_ADDED -> {
          deletions.remove(key);
          added.put(key, change);
          if (change.yanked()) {
            yanks.put(key, IndexChange.yanked(change.name(), change.version()));
          } else {
            yanks.remove(key);
          }
        }
        case YANKED, UNYANKED -> yanks.put(key, change);
        case VERSION_DELETED -> {
          added.remove(key);
          yanks.remove(key);
          deletions.put(key, change);
        }
        case PACKAGE_DELETED -> {
          String prefix = PackageNames.normalize(change.name()) + "@";
          added.keySet().removeIf(k -> k.startsWith(prefix));
          yanks.keySet().removeIf(k -> k.startsWith(prefix));
          deletions.keySet().removeIf(k -> k.startsWith(prefix));
          deletions.put(key, change);
        }
      }
    }
    return new ChangeSet(from, diff.reference(),
        new ArrayList<>(added.values()),
        new ArrayList<>(yanks.values()),
        List.copyOf(deletions.values()),
        false);
  }

  private static String key(IndexChange change) {
    String name = PackageNames.normalize(change.name());
    return change.version() == null ? name + "@*" : name + "@" + change.version();
  }
}
