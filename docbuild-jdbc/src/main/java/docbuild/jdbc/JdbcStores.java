package docbuild.jdbc;

import docbuild.jdbc.dialect.Dialects;
import docbuild.jdbc.spi.Dialect;
import docbuild.jdbc.store.JdbcBlacklistStore;
import docbuild.jdbc.store.JdbcBuildStore;
import docbuild.jdbc.store.JdbcCheckpointStore;
import docbuild.jdbc.store.JdbcPriorityRuleStore;
import docbuild.jdbc.store.JdbcQueueStore;
import docbuild.jdbc.store.JdbcReleaseStatusStore;
import docbuild.jdbc.store.JdbcReleaseStore;
import docbuild.jdbc.store.JdbcSandboxPolicyStore;
import docbuild.jdbc.store.JdbcServiceConfigStore;
import docbuild.spi.DocBuildStores;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Factory for the full set of JDBC stores.
 *
 * <pre>{@code
 * DocBuildStores stores = JdbcStores.detect(dataSource);
 * DocBuildStores stores = JdbcStores.create(Dialects.get("postgresql"));
 * }</pre>
 */
public final class JdbcStores {

  private JdbcStores() {
  }

  public static DocBuildStores create(Dialect dialect) {
    Objects.requireNonNull(dialect, "dialect");
    return new DocBuildStores(
        new JdbcQueueStore(dialect),
        new JdbcReleaseStore(dialect),
        new JdbcBuildStore(),
        new JdbcReleaseStatusStore(dialect),
        new JdbcCheckpointStore(dialect),
        new JdbcServiceConfigStore(dialect),
        new JdbcBlacklistStore(dialect),
        new JdbcPriorityRuleStore(),
        new JdbcSandboxPolicyStore(dialect));
  }

  /**
   * Creates stores for the dialect matching the DataSource's JDBC URL.
   */
  public static DocBuildStores detect(DataSource dataSource) {
    return create(Dialects.detect(dataSource));
  }
}
