package docbuild.registry;

/**
 * Differences found (and, unless {@code dryRun}, repaired) by one
 * {@link ConsistencyChecker} run.
 *
 * @param releasesQueued   index releases missing from the database that were queued
 * @param releasesDeleted  database releases absent from the index
 * @param packagesDeleted  database packages absent from the index
 * @param yanksCorrected   releases whose yanked flag disagreed with the index
 */
public record ConsistencyReport(
    boolean dryRun,
    int releasesQueued,
    int releasesDeleted,
    int packagesDeleted,
    int yanksCorrected
) {

  public boolean consistent() {
    return releasesQueued == 0 && releasesDeleted == 0 && packagesDeleted == 0 && yanksCorrected == 0;
  }
}
