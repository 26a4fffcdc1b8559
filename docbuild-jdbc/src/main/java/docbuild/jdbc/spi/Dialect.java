package docbuild.jdbc.spi;

import docbuild.model.QueueEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific parts of the JDBC stores:
 * duplicate-tolerant inserts and the exclusive queue claim. Register custom
 * dialects via {@code META-INF/services/docbuild.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see docbuild.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /** Classpath location of the DDL script for this dialect. */
  default String schemaResource() {
    return "schema/" + name() + ".sql";
  }

  /**
   * Inserts one row unless a row with the same unique key already exists.
   * Must not abort the surrounding transaction on a duplicate.
   *
   * @param keyColumns columns of the unique key that may conflict
   * @return {@code 1} if inserted, {@code 0} if a duplicate existed
   */
  int insertIfAbsent(Connection conn, String table, List<String> columns, List<String> keyColumns,
      Object... values);

  /**
   * Claims the most urgent eligible queue entry: lowest priority, then lowest
   * id, with {@code attempts < maxAttempts}, {@code available_at <= now} and
   * no live claim (a claim older than {@code lockExpiry} is dead).
   *
   * <p>Sets {@code locked_by} and {@code locked_at} on the claimed row. Two
   * concurrent callers never claim the same row.
   */
  Optional<QueueEntry> claimNext(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      int maxAttempts);
}
