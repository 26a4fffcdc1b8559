package docbuild.spi;

import docbuild.model.ReleaseStatus;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence contract for the materialized per-release status.
 */
public interface ReleaseStatusStore {

  void upsert(Connection conn, ReleaseStatus status);

  Optional<ReleaseStatus> find(Connection conn, long releaseId);
}
