package docbuild.jdbc.store;

import docbuild.jdbc.JdbcTemplate;
import docbuild.model.PriorityRule;
import docbuild.spi.PriorityRuleStore;

import java.sql.Connection;
import java.util.List;

/**
 * Rules are returned in insertion order; the first match wins.
 */
public final class JdbcPriorityRuleStore implements PriorityRuleStore {
  private static final JdbcTemplate.RowMapper<PriorityRule> ROW_MAPPER = rs -> new PriorityRule(
      rs.getLong("id"), rs.getString("pattern"), rs.getInt("priority"));

  @Override
  public List<PriorityRule> list(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT id, pattern, priority FROM priority_rules ORDER BY id", ROW_MAPPER);
  }

  @Override
  public PriorityRule add(Connection conn, String pattern, int priority) {
    if (pattern == null || pattern.isEmpty()) {
      throw new IllegalArgumentException("pattern must not be empty");
    }
    long id = JdbcTemplate.insertReturningId(conn,
        "INSERT INTO priority_rules (pattern, priority) VALUES (?,?)", pattern, priority);
    return new PriorityRule(id, pattern, priority);
  }

  @Override
  public int remove(Connection conn, String pattern) {
    return JdbcTemplate.update(conn, "DELETE FROM priority_rules WHERE pattern=?", pattern);
  }
}
