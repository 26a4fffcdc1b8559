package docbuild.util;

import docbuild.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs units of store work on a freshly obtained connection, either inside a
 * single transaction or in auto-commit mode.
 *
 * <pre>{@code
 * long releaseId = Transactions.inTransaction(connectionProvider, conn -> {
 *   long id = stores.releases().ensureRelease(conn, name, version);
 *   stores.queue().enqueue(conn, name, version, priority, null, now);
 *   return id;
 * });
 * }</pre>
 */
public final class Transactions {
  private static final Logger logger = Logger.getLogger(Transactions.class.getName());

  /**
   * A unit of work against an open connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  private Transactions() {}

  /**
   * Executes {@code work} in one transaction. Commits on normal return, rolls
   * back and rethrows on any exception.
   */
  public static <T> T inTransaction(ConnectionProvider connectionProvider, SqlWork<T> work)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn);
      }
    }
  }

  /**
   * Executes {@code work} with auto-commit enabled; each statement commits on its own.
   */
  public static <T> T autoCommit(ConnectionProvider connectionProvider, SqlWork<T> work)
      throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.execute(conn);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void restoreAutoCommit(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    }
  }
}
