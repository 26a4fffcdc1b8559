package docbuild.spi;

import docbuild.model.BuildAttempt;
import docbuild.model.BuildStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the append-only build attempt history.
 */
public interface BuildStore {

  /**
   * Inserts a new attempt in {@link BuildStatus#IN_PROGRESS} state.
   *
   * @return the generated attempt id
   */
  long insertInProgress(Connection conn, long releaseId, String builderVersion, String buildServer, Instant startedAt);

  /** Replaces the stored log of an attempt that is still in progress. */
  int updateOutput(Connection conn, long buildId, String output);

  /**
   * Moves an in-progress attempt to a terminal status. Attempts that already
   * concluded are left untouched.
   *
   * @return rows updated
   */
  int finish(Connection conn, long buildId, BuildStatus status, String toolchainVersion,
      Instant finishedAt, String output);

  Optional<BuildAttempt> find(Connection conn, long buildId);

  /** All attempts of a release, oldest first. */
  List<BuildAttempt> listForRelease(Connection conn, long releaseId);

  /** In-progress attempts started before {@code startedBefore}. */
  List<BuildAttempt> findInProgressBefore(Connection conn, Instant startedBefore);
}
