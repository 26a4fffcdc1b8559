package docbuild.registry;

/**
 * Summary of one synchronization run.
 *
 * @param enqueued            new queue entries created
 * @param alreadyQueued       added releases that were already in the queue
 * @param blacklisted         added releases dropped by the blacklist
 * @param yankUpdates         yank flags written
 * @param deletions           releases or packages deleted
 * @param checkpointAdvanced  whether the stored checkpoint moved to {@code toReference}
 */
public record SyncResult(
    Outcome outcome,
    String fromReference,
    String toReference,
    int enqueued,
    int alreadyQueued,
    int blacklisted,
    int yankUpdates,
    int deletions,
    boolean checkpointAdvanced
) {

  public enum Outcome {
    /** Changes were applied (possibly none). */
    COMPLETED,
    /** No checkpoint existed; the index head was adopted as the starting point. */
    BASELINED,
    /** Another instance holds the checkpoint lock. */
    SKIPPED_LOCKED
  }

  static SyncResult skipped() {
    return new SyncResult(Outcome.SKIPPED_LOCKED, null, null, 0, 0, 0, 0, 0, false);
  }

  static SyncResult baselined(String reference, boolean advanced) {
    return new SyncResult(Outcome.BASELINED, null, reference, 0, 0, 0, 0, 0, advanced);
  }
}
