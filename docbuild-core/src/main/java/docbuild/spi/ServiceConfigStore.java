package docbuild.spi;

import java.sql.Connection;
import java.util.Optional;

/**
 * Key/value service settings shared by every instance, such as the queue pause flag.
 */
public interface ServiceConfigStore {

  Optional<String> get(Connection conn, String key);

  void set(Connection conn, String key, String value);
}
