package docbuild.admin;

import docbuild.model.BuildAttempt;
import docbuild.model.QueueEntry;
import docbuild.model.Release;
import docbuild.model.ReleaseStatus;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only query facade for build state.
 *
 * <p>Manages connection lifecycle internally. A failed query is logged and
 * answered with an empty result.
 */
public final class BuildQueries {
  private static final Logger logger = Logger.getLogger(BuildQueries.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final int maxAttempts;

  public BuildQueries(ConnectionProvider connectionProvider, DocBuildStores stores, int maxAttempts) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.maxAttempts = maxAttempts;
  }

  /**
   * Aggregated build status of a release.
   *
   * @return empty if the release is unknown or has never been built
   */
  public Optional<ReleaseStatus> releaseStatus(String name, String version) {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.releases().find(conn, name, version)
          .flatMap(release -> stores.statuses().find(conn, release.id()));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to read status of " + name + " " + version, e);
      return Optional.empty();
    }
  }

  public Optional<Release> release(String name, String version) {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.releases().find(conn, name, version);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to read release " + name + " " + version, e);
      return Optional.empty();
    }
  }

  /** Every attempt for a release, oldest first. */
  public List<BuildAttempt> builds(String name, String version) {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.releases().find(conn, name, version)
          .map(release -> stores.builds().listForRelease(conn, release.id()))
          .orElse(List.of());
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list builds of " + name + " " + version, e);
      return List.of();
    }
  }

  public Optional<BuildAttempt> build(long buildId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.builds().find(conn, buildId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to read build " + buildId, e);
      return Optional.empty();
    }
  }

  /** Queue contents in dequeue order, exhausted entries included. */
  public List<QueueEntry> queue() {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.queue().list(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list the build queue", e);
      return List.of();
    }
  }

  public Map<Integer, Integer> pendingCountByPriority() {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.queue().pendingCountByPriority(conn, maxAttempts);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count queued releases", e);
      return Map.of();
    }
  }

  public boolean isQueued(String name, String version) {
    try (Connection conn = connectionProvider.getConnection()) {
      return stores.queue().isQueued(conn, name, version);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to check queue for " + name + " " + version, e);
      return false;
    }
  }
}
