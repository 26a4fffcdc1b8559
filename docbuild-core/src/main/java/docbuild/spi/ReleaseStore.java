package docbuild.spi;

import docbuild.model.BuildOutputs;
import docbuild.model.PackageInfo;
import docbuild.model.Release;
import docbuild.model.ReleaseMetadata;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for packages and releases.
 */
public interface ReleaseStore {

  /**
   * Returns the id of the release, creating the package and release rows if
   * either is missing. Safe under concurrent callers.
   */
  long ensureRelease(Connection conn, String name, String version);

  Optional<Release> find(Connection conn, String name, String version);

  Optional<Release> findById(Connection conn, long releaseId);

  /**
   * Row-locks the release until the caller's transaction ends. Concurrent
   * lockers of the same release wait for each other.
   *
   * @return {@code false} if the release does not exist
   */
  boolean lockRelease(Connection conn, long releaseId);

  Optional<PackageInfo> findPackage(Connection conn, String name);

  /** Overwrites the registry metadata of a release. A {@code null} library flag keeps the stored one. */
  void updateMetadata(Connection conn, long releaseId, ReleaseMetadata metadata);

  /**
   * Sets the yanked flag.
   *
   * @return rows updated; {@code 0} when the release is unknown
   */
  int setYanked(Connection conn, String name, String version, boolean yanked);

  void recordBuildOutputs(Connection conn, long releaseId, BuildOutputs outputs);

  /** Points the package at its newest non-yanked release. */
  void refreshLatestRelease(Connection conn, String name);

  /** Deletes a release together with its build attempts and status row. */
  int deleteRelease(Connection conn, String name, String version);

  /** Deletes a package with all of its releases. */
  int deletePackage(Connection conn, String name);

  List<Release> listAll(Connection conn);

  List<Long> listReleaseIds(Connection conn);

  /**
   * Latest release of each package whose aggregated status is success with
   * documentation, ordered by last build time ascending.
   */
  List<Release> latestDocumentedReleases(Connection conn, int limit);
}
