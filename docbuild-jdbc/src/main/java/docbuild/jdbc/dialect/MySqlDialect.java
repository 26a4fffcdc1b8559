package docbuild.jdbc.dialect;

import docbuild.jdbc.DocBuildStoreException;
import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.QueueRows;
import docbuild.model.QueueEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MySQL dialect, also used for TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values) {
    String sql = "INSERT IGNORE" + insertSql(table, columns).substring("INSERT".length());
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, values);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new DocBuildStoreException("Failed to insert into " + table, e);
    }
  }

  @Override
  public Optional<QueueEntry> claimNext(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      int maxAttempts) {
    Objects.requireNonNull(ownerId, "ownerId");
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // MySQL supports UPDATE...ORDER BY...LIMIT (no subquery needed)
    String claimSql = "UPDATE " + QueueRows.TABLE + " SET locked_by=?, locked_at=? WHERE "
        + QueueRows.CLAIMABLE + " ORDER BY priority, id LIMIT 1";
    int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, maxAttempts, nowMs, lockExpiry);
    if (updated == 0) {
      return Optional.empty();
    }
    return selectClaimed(conn, ownerId, nowMs);
  }
}
