package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.BuildStatus;
import docbuild.model.ReleaseStatus;
import docbuild.spi.ReleaseStatusStore;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for the materialized {@code release_build_status} rows.
 */
public final class JdbcReleaseStatusStore implements ReleaseStatusStore {
  private final Dialect dialect;

  public JdbcReleaseStatusStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public void upsert(Connection conn, ReleaseStatus status) {
    String update = "UPDATE release_build_status SET status=?, last_build_time=? WHERE release_id=?";
    if (JdbcTemplate.update(conn, update, status.status().code(), status.lastBuildTime(), status.releaseId()) > 0) {
      return;
    }
    int inserted = dialect.insertIfAbsent(conn, "release_build_status",
        List.of("release_id", "status", "last_build_time"), List.of("release_id"),
        status.releaseId(), status.status().code(), status.lastBuildTime());
    if (inserted == 0) {
      // lost an insert race; the row exists now
      JdbcTemplate.update(conn, update, status.status().code(), status.lastBuildTime(), status.releaseId());
    }
  }

  @Override
  public Optional<ReleaseStatus> find(Connection conn, long releaseId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT release_id, status, last_build_time FROM release_build_status WHERE release_id=?",
        rs -> new ReleaseStatus(
            rs.getLong("release_id"),
            BuildStatus.fromCode(rs.getString("status")),
            JdbcTemplate.instant(rs, "last_build_time")),
        releaseId);
  }
}
