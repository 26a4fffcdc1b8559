package docbuild.registry;

import docbuild.model.PackageNames;
import docbuild.model.Release;
import docbuild.priority.BlacklistFilter;
import docbuild.priority.Priorities;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.util.Transactions;

import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares a full index snapshot with the release tables and repairs drift
 * that incremental synchronization cannot see, such as changes made while no
 * checkpoint existed.
 *
 * <p>Missing releases are queued at {@link Priorities#CONSISTENCY_CHECK};
 * releases and packages no longer in the index are deleted; yanked flags are
 * aligned with the index. A dry run only counts.
 */
public final class ConsistencyChecker {
  private static final Logger logger = Logger.getLogger(ConsistencyChecker.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final RegistryIndex index;
  private final String registry;

  public ConsistencyChecker(ConnectionProvider connectionProvider, DocBuildStores stores,
      RegistryIndex index, String registry) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.index = Objects.requireNonNull(index, "index");
    this.registry = registry;
  }

  /**
   * Runs one comparison.
   *
   * @param dryRun when {@code true} nothing is written
   * @throws RegistryIndexException        if the index is unreachable
   * @throws UnsupportedOperationException if the index cannot produce snapshots
   */
  public ConsistencyReport check(boolean dryRun) throws SQLException {
    IndexSnapshot snapshot = index.snapshot();
    Map<String, IndexSnapshot.Entry> indexed = new LinkedHashMap<>();
    Set<String> indexedPackages = new HashSet<>();
    for (IndexSnapshot.Entry entry : snapshot.releases()) {
      indexed.put(key(entry.name(), entry.version()), entry);
      indexedPackages.add(PackageNames.normalize(entry.name()));
    }

    ConsistencyReport report = Transactions.inTransaction(connectionProvider, conn -> {
      Map<String, Release> stored = new HashMap<>();
      for (Release release : stores.releases().listAll(conn)) {
        stored.put(key(release.name(), release.version()), release);
      }
      BlacklistFilter blacklist = new BlacklistFilter(stores.blacklist().list(conn));
      Instant now = Instant.now();

      int queued = 0;
      int yanks = 0;
      for (Map.Entry<String, IndexSnapshot.Entry> e : indexed.entrySet()) {
        IndexSnapshot.Entry entry = e.getValue();
        Release release = stored.get(e.getKey());
        if (release == null) {
          if (blacklist.isBlacklisted(entry.name())
              || stores.queue().isQueued(conn, entry.name(), entry.version())) {
            continue;
          }
          queued++;
          if (!dryRun) {
            stores.queue().enqueue(conn, entry.name(), entry.version(),
                Priorities.CONSISTENCY_CHECK, registry, now);
          }
        } else if (release.yanked() != entry.yanked()) {
          yanks++;
          if (!dryRun) {
            stores.releases().setYanked(conn, entry.name(), entry.version(), entry.yanked());
            stores.releases().refreshLatestRelease(conn, entry.name());
          }
        }
      }

      int releasesDeleted = 0;
      Set<String> deletedPackages = new HashSet<>();
      for (Map.Entry<String, Release> e : stored.entrySet()) {
        if (indexed.containsKey(e.getKey())) {
          continue;
        }
        Release release = e.getValue();
        String name = PackageNames.normalize(release.name());
        if (!indexedPackages.contains(name)) {
          if (deletedPackages.add(name) && !dryRun) {
            stores.queue().removePackage(conn, name);
            stores.releases().deletePackage(conn, name);
          }
          continue;
        }
        releasesDeleted++;
        if (!dryRun) {
          stores.queue().remove(conn, release.name(), release.version());
          stores.releases().deleteRelease(conn, release.name(), release.version());
          stores.releases().refreshLatestRelease(conn, release.name());
        }
      }
      return new ConsistencyReport(dryRun, queued, releasesDeleted, deletedPackages.size(), yanks);
    });

    logger.log(Level.INFO, "Consistency check at {0}{1}: {2} queued, {3} releases deleted, "
        + "{4} packages deleted, {5} yanks corrected",
        new Object[]{snapshot.reference(), dryRun ? " (dry run)" : "", report.releasesQueued(),
            report.releasesDeleted(), report.packagesDeleted(), report.yanksCorrected()});
    return report;
  }

  private static String key(String name, String version) {
    return PackageNames.normalize(name) + "@" + version;
  }
}
