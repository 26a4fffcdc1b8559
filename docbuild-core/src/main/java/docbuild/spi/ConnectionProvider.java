package docbuild.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of the connections behind every sync cycle, build step and admin
 * call. Each call opens one short transaction and closes the connection
 * before any sandbox work starts, so a pool of a few connections serves many
 * workers.
 *
 * @see docbuild.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /** @return an open connection, closed by the caller */
  Connection getConnection() throws SQLException;
}
