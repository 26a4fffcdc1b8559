package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.model.BuildAttempt;
import docbuild.model.BuildStatus;
import docbuild.spi.BuildStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for the append-only {@code builds} table.
 *
 * <p>Start and finish times are stored with millisecond precision, the
 * precision of the queue timestamps they are compared with.
 */
public final class JdbcBuildStore implements BuildStore {
  private static final String COLUMNS =
      "id, release_id, toolchain_version, builder_version, status, started_at, finished_at, output, build_server";

  private static final JdbcTemplate.RowMapper<BuildAttempt> ROW_MAPPER = rs -> new BuildAttempt(
      rs.getLong("id"),
      rs.getLong("release_id"),
      rs.getString("toolchain_version"),
      rs.getString("builder_version"),
      BuildStatus.fromCode(rs.getString("status")),
      JdbcTemplate.instant(rs, "started_at"),
      JdbcTemplate.instant(rs, "finished_at"),
      rs.getString("output"),
      rs.getString("build_server"));

  @Override
  public long insertInProgress(Connection conn, long releaseId, String builderVersion, String buildServer,
      Instant startedAt) {
    String sql = "INSERT INTO builds (release_id, builder_version, status, started_at, build_server) "
        + "VALUES (?,?,?,?,?)";
    return JdbcTemplate.insertReturningId(conn, sql,
        releaseId, builderVersion, BuildStatus.IN_PROGRESS.code(), startedAt.truncatedTo(ChronoUnit.MILLIS),
        buildServer);
  }

  @Override
  public int updateOutput(Connection conn, long buildId, String output) {
    return JdbcTemplate.update(conn,
        "UPDATE builds SET output=? WHERE id=? AND status=?",
        output, buildId, BuildStatus.IN_PROGRESS.code());
  }

  @Override
  public int finish(Connection conn, long buildId, BuildStatus status, String toolchainVersion,
      Instant finishedAt, String output) {
    if (!status.isTerminal()) {
      throw new IllegalArgumentException("finish requires a terminal status, got " + status);
    }
    String sql = "UPDATE builds SET status=?, toolchain_version=COALESCE(?, toolchain_version), "
        + "finished_at=?, output=? WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql,
        status.code(), toolchainVersion, finishedAt.truncatedTo(ChronoUnit.MILLIS), output,
        buildId, BuildStatus.IN_PROGRESS.code());
  }

  @Override
  public Optional<BuildAttempt> find(Connection conn, long buildId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM builds WHERE id=?", ROW_MAPPER, buildId);
  }

  @Override
  public List<BuildAttempt> listForRelease(Connection conn, long releaseId) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM builds WHERE release_id=? ORDER BY id", ROW_MAPPER, releaseId);
  }

  @Override
  public List<BuildAttempt> findInProgressBefore(Connection conn, Instant startedBefore) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM builds WHERE status=? AND started_at < ? ORDER BY id",
        ROW_MAPPER, BuildStatus.IN_PROGRESS.code(), startedBefore);
  }
}
