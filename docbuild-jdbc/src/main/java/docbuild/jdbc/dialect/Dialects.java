package docbuild.jdbc.dialect;

import docbuild.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Looks up the dialects registered under
 * {@code META-INF/services/docbuild.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * DocBuildStores stores = JdbcStores.create(Dialects.detect(dataSource));
 * String ddl = Dialects.get("postgresql").schemaResource();
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> BY_NAME = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())) {
      Dialect previous = byName.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
      if (previous != null) {
        throw new IllegalStateException("Dialect " + dialect.name() + " registered twice: "
            + previous.getClass().getName() + ", " + dialect.getClass().getName());
      }
    }
    return Map.copyOf(byName);
  }

  public static List<Dialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name, case-insensitive
   * @throws IllegalArgumentException for an unregistered name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect " + name + ", registered: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Detects the dialect of the database behind a data source. Opens and
   * closes one connection.
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot open a connection to detect the dialect", e);
    }
  }

  /** Detects the dialect from the URL of an open connection. */
  public static Dialect detect(Connection conn) throws SQLException {
    return detect(conn.getMetaData().getURL());
  }

  /**
   * Picks the dialect with the longest matching URL prefix.
   *
   * @throws IllegalArgumentException if the URL is empty or no prefix matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL is empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    Dialect best = null;
    int bestLength = -1;
    for (Dialect dialect : BY_NAME.values()) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (prefix.length() > bestLength && url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          best = dialect;
          bestLength = prefix.length();
        }
      }
    }
    if (best == null) {
      throw new IllegalArgumentException("No dialect handles " + jdbcUrl);
    }
    return best;
  }
}
