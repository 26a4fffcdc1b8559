package docbuild.jdbc;

import docbuild.model.QueueEntry;

/**
 * Column list and row mapper for the {@code queue} table, shared by the queue
 * store and the dialect claim implementations.
 */
public final class QueueRows {

  public static final String TABLE = "queue";

  public static final String COLUMNS =
      "id, name, version, priority, registry, attempts, last_attempt, queued_at";

  /**
   * Predicate for entries a worker may claim. Parameters: max attempts,
   * now, lock expiry.
   */
  public static final String CLAIMABLE =
      "attempts < ? AND available_at <= ? AND (locked_by IS NULL OR locked_at < ?)";

  public static final JdbcTemplate.RowMapper<QueueEntry> MAPPER = rs -> new QueueEntry(
      rs.getLong("id"),
      rs.getString("name"),
      rs.getString("version"),
      rs.getInt("priority"),
      rs.getString("registry"),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "last_attempt"),
      JdbcTemplate.instant(rs, "queued_at"));

  private QueueRows() {}
}
