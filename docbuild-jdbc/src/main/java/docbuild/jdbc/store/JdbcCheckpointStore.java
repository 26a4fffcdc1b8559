package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.SyncCheckpoint;
import docbuild.spi.CheckpointStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for {@code sync_checkpoints}. A row with a {@code NULL}
 * reference exists once any instance has tried to lock the checkpoint.
 */
public final class JdbcCheckpointStore implements CheckpointStore {
  private static final List<String> INSERT_COLUMNS = List.of("name", "reference", "version", "updated_at");
  private static final List<String> KEY_COLUMNS = List.of("name");

  private final Dialect dialect;

  public JdbcCheckpointStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Optional<SyncCheckpoint> find(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn,
        "SELECT name, reference, version, updated_at FROM sync_checkpoints WHERE name=? AND reference IS NOT NULL",
        rs -> new SyncCheckpoint(
            rs.getString("name"),
            rs.getString("reference"),
            rs.getLong("version"),
            JdbcTemplate.instant(rs, "updated_at")),
        name);
  }

  @Override
  public boolean tryLock(Connection conn, String name, String ownerId, Instant now, Instant lockExpiry) {
    Objects.requireNonNull(ownerId, "ownerId");
    ensureRow(conn, name, now);
    String sql = "UPDATE sync_checkpoints SET locked_by=?, locked_at=? "
        + "WHERE name=? AND (locked_by IS NULL OR locked_by=? OR locked_at < ?)";
    return JdbcTemplate.update(conn, sql,
        ownerId, now.truncatedTo(ChronoUnit.MILLIS), name, ownerId, lockExpiry) == 1;
  }

  @Override
  public void unlock(Connection conn, String name, String ownerId) {
    JdbcTemplate.update(conn,
        "UPDATE sync_checkpoints SET locked_by=NULL, locked_at=NULL WHERE name=? AND locked_by=?",
        name, ownerId);
  }

  @Override
  public boolean compareAndSet(Connection conn, String name, long expectedVersion, String reference, Instant now) {
    Objects.requireNonNull(reference, "reference");
    if (expectedVersion < 0) {
      ensureRow(conn, name, now);
      return JdbcTemplate.update(conn,
          "UPDATE sync_checkpoints SET reference=?, version=version+1, updated_at=? "
              + "WHERE name=? AND reference IS NULL",
          reference, now, name) == 1;
    }
    return JdbcTemplate.update(conn,
        "UPDATE sync_checkpoints SET reference=?, version=version+1, updated_at=? "
            + "WHERE name=? AND version=? AND reference IS NOT NULL",
        reference, now, name, expectedVersion) == 1;
  }

  @Override
  public void reset(Connection conn, String name, String reference, Instant now) {
    Objects.requireNonNull(reference, "reference");
    ensureRow(conn, name, now);
    JdbcTemplate.update(conn,
        "UPDATE sync_checkpoints SET reference=?, version=version+1, updated_at=? WHERE name=?",
        reference, now, name);
  }

  private void ensureRow(Connection conn, String name, Instant now) {
    dialect.insertIfAbsent(conn, "sync_checkpoints", INSERT_COLUMNS, KEY_COLUMNS, name, null, 0L, now);
  }
}
