package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.QueueRows;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.BuildStatus;
import docbuild.model.PackageNames;
import docbuild.model.QueueEntry;
import docbuild.spi.QueueStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC queue store. Entries are keyed by normalized package name and version;
 * the claim itself is delegated to the {@link Dialect}.
 */
public final class JdbcQueueStore implements QueueStore {
  private static final String TABLE = QueueRows.TABLE;
  private static final List<String> INSERT_COLUMNS = List.of(
      "name", "normalized_name", "version", "priority", "registry", "attempts", "available_at", "queued_at");
  private static final List<String> KEY_COLUMNS = List.of("normalized_name", "version");

  private final Dialect dialect;

  public JdbcQueueStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public boolean enqueue(Connection conn, String name, String version, int priority, String registry,
      Instant now) {
    String normalized = PackageNames.normalize(name);
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    int inserted = dialect.insertIfAbsent(conn, TABLE, INSERT_COLUMNS, KEY_COLUMNS,
        name, normalized, version, priority, registry, 0, nowMs, nowMs);
    if (inserted > 0) {
      return true;
    }
    JdbcTemplate.update(conn,
        "UPDATE " + TABLE + " SET registry=? WHERE normalized_name=? AND version=?",
        registry, normalized, version);
    return false;
  }

  @Override
  public Optional<QueueEntry> claimNext(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      int maxAttempts) {
    Objects.requireNonNull(ownerId, "ownerId");
    return dialect.claimNext(conn, ownerId, now, lockExpiry, maxAttempts);
  }

  @Override
  public int pruneCompleted(Connection conn) {
    String sql = "DELETE FROM " + TABLE + " WHERE EXISTS ("
        + "SELECT 1 FROM builds b"
        + " JOIN releases r ON r.id = b.release_id"
        + " JOIN packages p ON p.id = r.package_id"
        + " WHERE p.normalized_name = " + TABLE + ".normalized_name"
        + " AND r.version = " + TABLE + ".version"
        + " AND b.status = '" + BuildStatus.SUCCESS.code() + "'"
        + " AND b.finished_at >= " + TABLE + ".queued_at)";
    return JdbcTemplate.update(conn, sql);
  }

  @Override
  public int markSucceeded(Connection conn, long entryId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE id=?", entryId);
  }

  @Override
  public int markFailed(Connection conn, long entryId, Instant now, Instant availableAt) {
    String sql = "UPDATE " + TABLE
        + " SET attempts=attempts+1, last_attempt=?, available_at=?, locked_by=NULL, locked_at=NULL"
        + " WHERE id=?";
    return JdbcTemplate.update(conn, sql, now.truncatedTo(ChronoUnit.MILLIS),
        availableAt.truncatedTo(ChronoUnit.MILLIS), entryId);
  }

  @Override
  public int releaseClaim(Connection conn, long entryId) {
    return JdbcTemplate.update(conn,
        "UPDATE " + TABLE + " SET locked_by=NULL, locked_at=NULL WHERE id=?", entryId);
  }

  @Override
  public boolean isQueued(Connection conn, String name, String version) {
    return find(conn, name, version).isPresent();
  }

  @Override
  public Optional<QueueEntry> find(Connection conn, String name, String version) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + QueueRows.COLUMNS + " FROM " + TABLE + " WHERE normalized_name=? AND version=?",
        QueueRows.MAPPER, PackageNames.normalize(name), version);
  }

  @Override
  public List<QueueEntry> list(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + QueueRows.COLUMNS + " FROM " + TABLE + " ORDER BY priority, id",
        QueueRows.MAPPER);
  }

  @Override
  public Map<Integer, Integer> pendingCountByPriority(Connection conn, int maxAttempts) {
    String sql = "SELECT priority, COUNT(*) AS pending FROM " + TABLE
        + " WHERE attempts < ? GROUP BY priority ORDER BY priority";
    Map<Integer, Integer> counts = new LinkedHashMap<>();
    JdbcTemplate.query(conn, sql, rs -> counts.put(rs.getInt("priority"), rs.getInt("pending")), maxAttempts);
    return counts;
  }

  @Override
  public int resetAttempts(Connection conn, String name, String version) {
    String sql = "UPDATE " + TABLE + " SET attempts=0, available_at=? WHERE normalized_name=? AND version=?";
    return JdbcTemplate.update(conn, sql, Instant.now().truncatedTo(ChronoUnit.MILLIS),
        PackageNames.normalize(name), version);
  }

  @Override
  public int remove(Connection conn, String name, String version) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE normalized_name=? AND version=?",
        PackageNames.normalize(name), version);
  }

  @Override
  public int removePackage(Connection conn, String name) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE normalized_name=?",
        PackageNames.normalize(name));
  }

  @Override
  public int deprioritizeOtherReleases(Connection conn, String name, String keepVersion, int priority) {
    String sql = "UPDATE " + TABLE + " SET priority=? WHERE normalized_name=? AND version<>? AND priority<?";
    return JdbcTemplate.update(conn, sql, priority, PackageNames.normalize(name), keepVersion, priority);
  }
}
