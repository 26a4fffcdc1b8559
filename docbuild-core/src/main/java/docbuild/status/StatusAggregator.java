package docbuild.status;

import docbuild.model.BuildAttempt;
import docbuild.model.BuildStatus;
import docbuild.model.ReleaseStatus;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.util.Transactions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Derives the single status of a release from all of its build attempts and
 * keeps the materialized {@code release_build_status} row in step.
 *
 * <p>Aggregation ignores attempt order: a release is {@code success} if any
 * attempt succeeded, otherwise {@code failure} if any failed, otherwise
 * {@code in_progress}. The last build time is the latest finish time among
 * concluded attempts.
 *
 * <p>Recomputation row-locks the release before reading its attempts, so two
 * transactions concluding attempts of the same release recompute one after
 * the other and the later one sees the earlier one's attempt.
 */
public final class StatusAggregator {
  private static final Logger logger = Logger.getLogger(StatusAggregator.class.getName());

  private final DocBuildStores stores;

  public StatusAggregator(DocBuildStores stores) {
    this.stores = Objects.requireNonNull(stores, "stores");
  }

  /**
   * Aggregates {@code attempts} of one release. A release without attempts
   * is reported as in progress.
   */
  public static ReleaseStatus aggregate(long releaseId, Collection<BuildAttempt> attempts) {
    boolean anySuccess = false;
    boolean anyFailure = false;
    Instant lastBuildTime = null;
    for (BuildAttempt attempt : attempts) {
      if (attempt.status() == BuildStatus.SUCCESS) {
        anySuccess = true;
      } else if (attempt.status() == BuildStatus.FAILURE) {
        anyFailure = true;
      }
      if (attempt.status().isTerminal() && attempt.finishedAt() != null
          && (lastBuildTime == null || attempt.finishedAt().isAfter(lastBuildTime))) {
        lastBuildTime = attempt.finishedAt();
      }
    }
    BuildStatus status = anySuccess ? BuildStatus.SUCCESS
        : anyFailure ? BuildStatus.FAILURE
        : BuildStatus.IN_PROGRESS;
    return new ReleaseStatus(releaseId, status, lastBuildTime);
  }

  /**
   * Recomputes and stores the status of one release inside the caller's transaction.
   */
  public ReleaseStatus recompute(Connection conn, long releaseId) {
    stores.releases().lockRelease(conn, releaseId);
    List<BuildAttempt> attempts = stores.builds().listForRelease(conn, releaseId);
    ReleaseStatus status = aggregate(releaseId, attempts);
    stores.statuses().upsert(conn, status);
    return status;
  }

  /**
   * Recomputes every release, one transaction per release.
   *
   * @return number of releases recomputed
   */
  public int repairAll(ConnectionProvider connectionProvider) throws SQLException {
    List<Long> releaseIds = Transactions.autoCommit(connectionProvider,
        conn -> stores.releases().listReleaseIds(conn));
    for (long releaseId : releaseIds) {
      Transactions.inTransaction(connectionProvider, conn -> recompute(conn, releaseId));
    }
    logger.log(Level.INFO, "Recomputed build status of {0} releases", releaseIds.size());
    return releaseIds.size();
  }
}
