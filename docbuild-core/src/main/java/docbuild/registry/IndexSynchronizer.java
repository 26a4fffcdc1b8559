package docbuild.registry;

import docbuild.model.PackageNames;
import docbuild.model.SyncCheckpoint;
import docbuild.priority.BlacklistFilter;
import docbuild.priority.PriorityResolver;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.spi.MetricsExporter;
import docbuild.util.Transactions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies registry index changes to the release tables and the build queue.
 *
 * <p>One run:
 * <ol>
 *   <li>takes the per-checkpoint lock, or returns {@link SyncResult.Outcome#SKIPPED_LOCKED};</li>
 *   <li>reads the change set since the stored checkpoint;</li>
 *   <li>applies deletions, then enqueues added releases (blacklist and priority
 *       rules applied), then writes yank flags, in batched transactions of
 *       idempotent upserts;</li>
 *   <li>advances the checkpoint by compare-and-swap, only after every batch committed;</li>
 *   <li>releases the lock.</li>
 * </ol>
 *
 * <p>Any failure leaves the checkpoint where it was. Re-running after a partial
 * application is safe: releases created by the failed run already exist, so
 * their entries would get rule priority, but the queue keeps the priority the
 * first run wrote.
 *
 * @see RegistrySnapshotReader
 * @see SyncPoller
 */
public final class IndexSynchronizer {
  private static final Logger logger = Logger.getLogger(IndexSynchronizer.class.getName());

  public static final String DEFAULT_CHECKPOINT = "registry";

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final RegistrySnapshotReader reader;
  private final String checkpointName;
  private final String registry;
  private final String ownerId;
  private final Duration lockTimeout;
  private final int batchSize;
  private final MetricsExporter metrics;

  private IndexSynchronizer(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(builder.stores, "stores");
    this.reader = new RegistrySnapshotReader(Objects.requireNonNull(builder.index, "index"));
    this.checkpointName = Objects.requireNonNull(builder.checkpointName, "checkpointName");
    this.ownerId = builder.ownerId != null
        ? builder.ownerId : "sync-" + UUID.randomUUID().toString().substring(0, 8);
    this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout");
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be positive");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.registry = builder.registry;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String checkpointName() {
    return checkpointName;
  }

  /**
   * Runs one synchronization.
   *
   * @return what the run did
   * @throws RegistryIndexException if the index is unreachable
   * @throws SQLException           if the database is unavailable
   */
  public SyncResult synchronize() throws SQLException {
    Instant now = Instant.now();
    boolean locked = Transactions.autoCommit(connectionProvider, conn ->
        stores.checkpoints().tryLock(conn, checkpointName, ownerId, now, now.minus(lockTimeout)));
    if (!locked) {
      logger.log(Level.FINE, "Checkpoint {0} is locked by another instance; skipping sync", checkpointName);
      return SyncResult.skipped();
    }
    try {
      return synchronizeLocked();
    } finally {
      unlock();
    }
  }

  private SyncResult synchronizeLocked() throws SQLException {
    Optional<SyncCheckpoint> checkpoint = Transactions.autoCommit(connectionProvider,
        conn -> stores.checkpoints().find(conn, checkpointName));
    ChangeSet changes = reader.read(checkpoint);

    if (changes.rebaselined()) {
      logger.log(Level.WARNING, "No checkpoint {0} found; starting from index head {1}. "
          + "Releases published before this point are not queued.",
          new Object[]{checkpointName, changes.toReference()});
      boolean advanced = advance(-1L, changes.toReference());
      return SyncResult.baselined(changes.toReference(), advanced);
    }

    int deletions = applyDeletions(changes.deletions());
    EnqueueTally tally = applyAdditions(changes.added());
    int yankUpdates = applyYanks(changes.yankChanges());

    boolean advanced = false;
    if (changes.moved()) {
      advanced = advance(checkpoint.get().version(), changes.toReference());
      if (!advanced) {
        logger.log(Level.WARNING, "Checkpoint {0} moved concurrently; leaving it as is",
            checkpointName);
      }
    }

    SyncResult result = new SyncResult(SyncResult.Outcome.COMPLETED,
        changes.fromReference(), changes.toReference(),
        tally.enqueued, tally.alreadyQueued, tally.blacklisted, yankUpdates, deletions, advanced);
    if (!changes.isEmpty()) {
      logger.log(Level.INFO, "Synchronized {0} -> {1}: {2} enqueued, {3} already queued, "
          + "{4} blacklisted, {5} yank updates, {6} deletions",
          new Object[]{changes.fromReference(), changes.toReference(), tally.enqueued,
              tally.alreadyQueued, tally.blacklisted, yankUpdates, deletions});
    }
    return result;
  }

  private int applyDeletions(List<IndexChange> deletions) throws SQLException {
    int applied = 0;
    for (List<IndexChange> batch : batches(deletions)) {
      applied += Transactions.inTransaction(connectionProvider, conn -> {
        int count = 0;
        for (IndexChange change : batch) {
          if (change.kind() == IndexChange.Kind.PACKAGE_DELETED) {
            stores.queue().removePackage(conn, change.name());
            count += stores.releases().deletePackage(conn, change.name());
          } else {
            stores.queue().remove(conn, change.name(), change.version());
            count += stores.releases().deleteRelease(conn, change.name(), change.version());
            stores.releases().refreshLatestRelease(conn, change.name());
          }
        }
        return count;
      });
    }
    return applied;
  }

  private EnqueueTally applyAdditions(List<IndexChange> added) throws SQLException {
    EnqueueTally tally = new EnqueueTally();
    for (List<IndexChange> batch : batches(added)) {
      EnqueueTally batchTally = Transactions.inTransaction(connectionProvider,
          conn -> enqueueBatch(conn, batch));
      tally.add(batchTally);
    }
    for (int i = 0; i < tally.enqueued; i++) {
      metrics.incrementEnqueued();
    }
    for (int i = 0; i < tally.blacklisted; i++) {
      metrics.incrementBlacklistSkipped();
    }
    return tally;
  }

  private EnqueueTally enqueueBatch(Connection conn, List<IndexChange> batch) {
    EnqueueTally tally = new EnqueueTally();
    BlacklistFilter blacklist = new BlacklistFilter(stores.blacklist().list(conn));
    PriorityResolver priorities = new PriorityResolver(stores.priorityRules().list(conn));
    Instant now = Instant.now();
    Set<String> touchedPackages = new LinkedHashSet<>();

    for (IndexChange change : batch) {
      if (blacklist.isBlacklisted(change.name())) {
        tally.blacklisted++;
        logger.log(Level.FINE, "Skipping blacklisted {0} {1}",
            new Object[]{change.name(), change.version()});
        continue;
      }
      boolean newRelease = stores.releases().find(conn, change.name(), change.version()).isEmpty();
      int priority = priorities.resolve(change.name(), newRelease);
      long releaseId = stores.releases().ensureRelease(conn, change.name(), change.version());
      stores.releases().updateMetadata(conn, releaseId, change.metadata());

      if (stores.queue().enqueue(conn, change.name(), change.version(), priority, registry, now)) {
        tally.enqueued++;
      } else {
        tally.alreadyQueued++;
      }
      touchedPackages.add(PackageNames.normalize(change.name()));
    }
    for (String name : touchedPackages) {
      stores.releases().refreshLatestRelease(conn, name);
    }
    return tally;
  }

  private int applyYanks(List<IndexChange> yanks) throws SQLException {
    int applied = 0;
    for (List<IndexChange> batch : batches(yanks)) {
      applied += Transactions.inTransaction(connectionProvider, conn -> {
        int count = 0;
        for (IndexChange change : batch) {
          int updated = stores.releases().setYanked(conn, change.name(), change.version(), change.yanked());
          if (updated > 0) {
            count++;
            stores.releases().refreshLatestRelease(conn, change.name());
          } else if (!stores.queue().isQueued(conn, change.name(), change.version())) {
            logger.log(Level.WARNING, "Yank change for unknown release {0} {1} ignored",
                new Object[]{change.name(), change.version()});
          }
        }
        return count;
      });
    }
    return applied;
  }

  private boolean advance(long expectedVersion, String reference) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn ->
        stores.checkpoints().compareAndSet(conn, checkpointName, expectedVersion, reference, Instant.now()));
  }

  private void unlock() {
    try {
      Transactions.autoCommit(connectionProvider, conn -> {
        stores.checkpoints().unlock(conn, checkpointName, ownerId);
        return null;
      });
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to release checkpoint lock " + checkpointName
          + "; it expires after " + lockTimeout, e);
    }
  }

  private List<List<IndexChange>> batches(List<IndexChange> changes) {
    if (changes.size() <= batchSize) {
      return changes.isEmpty() ? List.of() : List.of(changes);
    }
    List<List<IndexChange>> batches = new ArrayList<>();
    for (int i = 0; i < changes.size(); i += batchSize) {
      batches.add(changes.subList(i, Math.min(changes.size(), i + batchSize)));
    }
    return batches;
  }

  private static final class EnqueueTally {
    int enqueued;
    int alreadyQueued;
    int blacklisted;

    void add(EnqueueTally other) {
      enqueued += other.enqueued;
      alreadyQueued += other.alreadyQueued;
      blacklisted += other.blacklisted;
    }
  }

  /** Builder for {@link IndexSynchronizer}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DocBuildStores stores;
    private RegistryIndex index;
    private String checkpointName = DEFAULT_CHECKPOINT;
    private String registry;
    private String ownerId;
    private Duration lockTimeout = Duration.ofMinutes(10);
    private int batchSize = 200;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the connection provider used for every sync transaction.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the persistence backends.
     *
     * <p><b>Required.</b>
     */
    public Builder stores(DocBuildStores stores) {
      this.stores = stores;
      return this;
    }

    /**
     * Sets the registry index to read changes from.
     *
     * <p><b>Required.</b>
     */
    public Builder index(RegistryIndex index) {
      this.index = index;
      return this;
    }

    /**
     * Sets the checkpoint row name. Distinct names let several registries sync independently.
     *
     * <p>Optional. Defaults to {@code "registry"}.
     */
    public Builder checkpointName(String checkpointName) {
      this.checkpointName = checkpointName;
      return this;
    }

    /**
     * Sets the registry-of-origin tag written on queue entries.
     *
     * <p>Optional. Defaults to {@code null} (the default registry).
     */
    public Builder registry(String registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the identity used when holding the checkpoint lock.
     *
     * <p>Optional. Defaults to a random {@code sync-xxxxxxxx} id.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * Sets how long a checkpoint lock is honoured before another instance may take it over.
     *
     * <p>Optional. Defaults to 10 minutes. Must be positive.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * Sets the number of changes applied per transaction.
     *
     * <p>Optional. Defaults to {@code 200}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public IndexSynchronizer build() {
      return new IndexSynchronizer(this);
    }
  }
}
