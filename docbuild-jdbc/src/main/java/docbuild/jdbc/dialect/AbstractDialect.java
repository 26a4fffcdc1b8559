package docbuild.jdbc.dialect;

import docbuild.jdbc.DocBuildStoreException;
import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.QueueRows;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.QueueEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>The default insert treats a unique-key violation as "already present",
 * which is only safe on databases that roll back the failed statement alone.
 * The default claim selects candidates, then takes them one by one with a
 * conditional update; a candidate another caller took first simply updates
 * no row.
 */
public abstract class AbstractDialect implements Dialect {
  private static final int CLAIM_CANDIDATES = 8;

  @Override
  public int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values) {
    String sql = insertSql(table, columns);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, values);
      return ps.executeUpdate();
    } catch (SQLException e) {
      if (isDuplicateKey(e)) {
        return 0;
      }
      throw new DocBuildStoreException("Failed to insert into " + table, e);
    }
  }

  @Override
  public Optional<QueueEntry> claimNext(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      int maxAttempts) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    List<Long> candidates = JdbcTemplate.query(conn,
        "SELECT id FROM " + QueueRows.TABLE + " WHERE " + QueueRows.CLAIMABLE
            + " ORDER BY priority, id LIMIT ?",
        rs -> rs.getLong("id"),
        maxAttempts, nowMs, lockExpiry, CLAIM_CANDIDATES);
    String claimSql = "UPDATE " + QueueRows.TABLE + " SET locked_by=?, locked_at=? WHERE id=? AND "
        + QueueRows.CLAIMABLE;
    for (long id : candidates) {
      int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, id, maxAttempts, nowMs, lockExpiry);
      if (updated == 1) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + QueueRows.COLUMNS + " FROM " + QueueRows.TABLE + " WHERE id=?",
            QueueRows.MAPPER, id);
      }
    }
    return Optional.empty();
  }

  /**
   * Selects the row claimed by {@code ownerId} at {@code lockedAt}. Shared by
   * dialects that claim with a single UPDATE and read the row back.
   */
  protected Optional<QueueEntry> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + QueueRows.COLUMNS + " FROM " + QueueRows.TABLE
            + " WHERE locked_by=? AND locked_at=? ORDER BY id",
        QueueRows.MAPPER, ownerId, lockedAt);
  }

  protected static String insertSql(String table, List<String> columns) {
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
        + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
  }

  protected static void bind(PreparedStatement ps, Object... values) throws SQLException {
    for (int i = 0; i < values.length; i++) {
      Object value = values[i];
      if (value instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else {
        ps.setObject(i + 1, value);
      }
    }
  }

  /** SQLState class 23 is integrity constraint violation. */
  protected static boolean isDuplicateKey(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
