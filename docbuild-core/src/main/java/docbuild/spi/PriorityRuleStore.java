package docbuild.spi;

import docbuild.model.PriorityRule;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence contract for name-pattern priority rules.
 */
public interface PriorityRuleStore {

  /** Rules in configured (insertion) order. */
  List<PriorityRule> list(Connection conn);

  PriorityRule add(Connection conn, String pattern, int priority);

  int remove(Connection conn, String pattern);
}
