package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.spi.Dialect;
import docbuild.spi.ServiceConfigStore;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class JdbcServiceConfigStore implements ServiceConfigStore {
  private final Dialect dialect;

  public JdbcServiceConfigStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Optional<String> get(Connection conn, String key) {
    return JdbcTemplate.queryOne(conn,
        "SELECT config_value FROM service_config WHERE config_key=?",
        rs -> rs.getString("config_value"), key);
  }

  @Override
  public void set(Connection conn, String key, String value) {
    String update = "UPDATE service_config SET config_value=? WHERE config_key=?";
    if (JdbcTemplate.update(conn, update, value, key) > 0) {
      return;
    }
    if (dialect.insertIfAbsent(conn, "service_config",
        List.of("config_key", "config_value"), List.of("config_key"), key, value) == 0) {
      JdbcTemplate.update(conn, update, value, key);
    }
  }
}
