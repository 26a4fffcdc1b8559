package docbuild.spi;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence contract for packages that must never be built.
 * Names are stored and compared in normalized form.
 */
public interface BlacklistStore {

  boolean contains(Connection conn, String name);

  /** Normalized names, sorted. */
  List<String> list(Connection conn);

  /** @return {@code false} if the name was already present */
  boolean add(Connection conn, String name);

  /** @return {@code false} if the name was not present */
  boolean remove(Connection conn, String name);
}
