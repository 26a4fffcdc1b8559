package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.jdbc.spi.Dialect;
import docbuild.model.PackageNames;
import docbuild.model.SandboxPolicy;
import docbuild.spi.SandboxPolicyStore;

import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for per-package sandbox overrides. Timeouts are kept in whole seconds.
 */
public final class JdbcSandboxPolicyStore implements SandboxPolicyStore {
  private static final String COLUMNS = "name, memory_bytes, timeout_seconds, max_targets";

  private static final JdbcTemplate.RowMapper<SandboxPolicy> ROW_MAPPER = rs -> {
    Long timeoutSeconds = JdbcTemplate.nullableLong(rs, "timeout_seconds");
    return new SandboxPolicy(
        rs.getString("name"),
        JdbcTemplate.nullableLong(rs, "memory_bytes"),
        timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds),
        JdbcTemplate.nullableInt(rs, "max_targets"));
  };

  private final Dialect dialect;

  public JdbcSandboxPolicyStore(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Optional<SandboxPolicy> find(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM sandbox_policies WHERE name=?",
        ROW_MAPPER, PackageNames.normalize(name));
  }

  @Override
  public void save(Connection conn, SandboxPolicy policy) {
    Long timeoutSeconds = policy.timeout() == null ? null : policy.timeout().toSeconds();
    String update = "UPDATE sandbox_policies SET memory_bytes=?, timeout_seconds=?, max_targets=? WHERE name=?";
    Object[] updateParams = {policy.memoryBytes(), timeoutSeconds, policy.maxTargets(), policy.packageName()};
    if (JdbcTemplate.update(conn, update, updateParams) > 0) {
      return;
    }
    int inserted = dialect.insertIfAbsent(conn, "sandbox_policies",
        List.of("name", "memory_bytes", "timeout_seconds", "max_targets"), List.of("name"),
        policy.packageName(), policy.memoryBytes(), timeoutSeconds, policy.maxTargets());
    if (inserted == 0) {
      JdbcTemplate.update(conn, update, updateParams);
    }
  }

  @Override
  public int remove(Connection conn, String name) {
    return JdbcTemplate.update(conn, "DELETE FROM sandbox_policies WHERE name=?", PackageNames.normalize(name));
  }

  @Override
  public List<SandboxPolicy> list(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM sandbox_policies ORDER BY name", ROW_MAPPER);
  }
}
