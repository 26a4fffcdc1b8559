package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.PackageNames;
import docbuild.spi.BlacklistStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public final class JdbcBlacklistStore implements BlacklistStore {
  private final Dialect dialect;

  public JdbcBlacklistStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public boolean contains(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn, "SELECT name FROM blacklist WHERE name=?",
        rs -> rs.getString("name"), PackageNames.normalize(name)).isPresent();
  }

  @Override
  public List<String> list(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT name FROM blacklist ORDER BY name", rs -> rs.getString("name"));
  }

  @Override
  public boolean add(Connection conn, String name) {
    return dialect.insertIfAbsent(conn, "blacklist", List.of("name", "created_at"), List.of("name"),
        PackageNames.normalize(name), Instant.now()) > 0;
  }

  @Override
  public boolean remove(Connection conn, String name) {
    return JdbcTemplate.update(conn, "DELETE FROM blacklist WHERE name=?", PackageNames.normalize(name)) > 0;
  }
}
