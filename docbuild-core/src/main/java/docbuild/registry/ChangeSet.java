package docbuild.registry;

import java.util.List;

/**
 * Result of reading the index against a checkpoint, split by what the
 * synchronizer has to do with each change.
 *
 * @param fromReference checkpoint the diff started from, {@code null} when re-baselined
 * @param toReference   reference to store once the changes are applied
 * @param added         releases to enqueue
 * @param yankChanges   yank flag updates, including those of releases added yanked
 * @param deletions     releases or packages removed from the index
 * @param rebaselined   {@code true} when there was no checkpoint and the head
 *                      was adopted without replaying history
 */
public record ChangeSet(
    String fromReference,
    String toReference,
    List<IndexChange> added,
    List<IndexChange> yankChanges,
    List<IndexChange> deletions,
    boolean rebaselined
) {

  public ChangeSet {
    added = List.copyOf(added);
    yankChanges = List.copyOf(yankChanges);
    deletions = List.copyOf(deletions);
  }

  static ChangeSet rebaseline(String head) {
    return new ChangeSet(null, head, List.of(), List.of(), List.of(), true);
  }

  public boolean isEmpty() {
    return added.isEmpty() && yankChanges.isEmpty() && deletions.isEmpty();
  }

  public boolean moved() {
    return fromReference == null || !fromReference.equals(toReference);
  }
}
