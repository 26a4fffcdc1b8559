package docbuild.spi;

import docbuild.model.SandboxPolicy;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for per-package sandbox overrides, keyed by normalized name.
 */
public interface SandboxPolicyStore {

  Optional<SandboxPolicy> find(Connection conn, String name);

  void save(Connection conn, SandboxPolicy policy);

  int remove(Connection conn, String name);

  List<SandboxPolicy> list(Connection conn);
}
