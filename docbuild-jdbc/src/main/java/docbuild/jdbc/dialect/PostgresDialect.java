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
import java.util.Optional;

/**
 * PostgreSQL dialect.
 *
 * <p>A failed statement aborts the whole transaction in PostgreSQL, so
 * duplicates are skipped with {@code ON CONFLICT DO NOTHING} instead of caught.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values) {
    String sql = insertSql(table, columns)
        + " ON CONFLICT (" + String.join(", ", keyColumns) + ") DO NOTHING";
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
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Single round-trip: FOR UPDATE SKIP LOCKED + RETURNING
    String sql = "UPDATE " + QueueRows.TABLE + " SET locked_by=?, locked_at=? "
        + "WHERE id = ("
        + "SELECT id FROM " + QueueRows.TABLE + " WHERE " + QueueRows.CLAIMABLE
        + " ORDER BY priority, id LIMIT 1 FOR UPDATE SKIP LOCKED"
        + ") RETURNING " + QueueRows.COLUMNS;
    List<QueueEntry> claimed = JdbcTemplate.updateReturning(conn, sql, QueueRows.MAPPER,
        ownerId, nowMs, maxAttempts, nowMs, lockExpiry);
    return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
  }
}
