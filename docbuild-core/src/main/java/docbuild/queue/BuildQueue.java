package docbuild.queue;

import docbuild.model.QueueEntry;
import docbuild.priority.BlacklistFilter;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.util.Transactions;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection-managing facade over {@link docbuild.spi.QueueStore}.
 *
 * <p>Every call obtains its own connection from the {@link ConnectionProvider}.
 * Outcome recording applies the {@link RetryPolicy} and the attempt ceiling:
 * an entry that fails {@code maxAttempts} times stays in the queue but is no
 * longer claimed until its attempts are reset.
 */
public final class BuildQueue {
  private static final Logger logger = Logger.getLogger(BuildQueue.class.getName());

  /** Service configuration key holding the pause flag. */
  public static final String LOCK_KEY = "queue_locked";

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;

  public BuildQueue(ConnectionProvider connectionProvider, DocBuildStores stores,
      RetryPolicy retryPolicy, int maxAttempts) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Adds a release to the queue unless its package is blacklisted.
   *
   * @return {@code true} if a new entry was created; {@code false} if the
   *         release was already queued (its priority is left unchanged) or blacklisted
   */
  public boolean enqueue(String name, String version, int priority, String registry) throws SQLException {
    return Transactions.inTransaction(connectionProvider, conn -> {
      if (new BlacklistFilter(stores.blacklist().list(conn)).isBlacklisted(name)) {
        logger.log(Level.INFO, "Not queueing blacklisted package {0} {1}", new Object[]{name, version});
        return false;
      }
      return stores.queue().enqueue(conn, name, version, priority, registry, Instant.now());
    });
  }

  /**
   * Removes entries already satisfied by a successful build, then claims the
   * next entry for {@code ownerId}.
   *
   * @param lockTimeout claims older than this are treated as abandoned
   */
  public Optional<QueueEntry> claimNext(String ownerId, Duration lockTimeout) throws SQLException {
    Transactions.autoCommit(connectionProvider, conn -> stores.queue().pruneCompleted(conn));
    Instant now = Instant.now();
    return Transactions.inTransaction(connectionProvider, conn ->
        stores.queue().claimNext(conn, ownerId, now, now.minus(lockTimeout), maxAttempts));
  }

  /** Deletes the entry after a successful build. */
  public void recordSuccess(QueueEntry entry) throws SQLException {
    Transactions.autoCommit(connectionProvider, conn -> stores.queue().markSucceeded(conn, entry.id()));
  }

  /**
   * Records a failed build and defers the entry according to the retry policy.
   *
   * @return {@code true} if the entry has now used up its attempts
   */
  public boolean recordFailure(QueueEntry entry) throws SQLException {
    int attempts = entry.attempts() + 1;
    Instant now = Instant.now();
    Instant availableAt = now.plusMillis(retryPolicy.computeDelayMs(attempts));
    Transactions.autoCommit(connectionProvider,
        conn -> stores.queue().markFailed(conn, entry.id(), now, availableAt));
    return attempts >= maxAttempts;
  }

  /** Releases a claim without consuming an attempt. */
  public void release(QueueEntry entry) throws SQLException {
    Transactions.autoCommit(connectionProvider, conn -> stores.queue().releaseClaim(conn, entry.id()));
  }

  /** Pauses dequeuing. Queued entries and their attempts are kept. */
  public void lock() throws SQLException {
    setLocked(true);
  }

  public void unlock() throws SQLException {
    setLocked(false);
  }

  public boolean isLocked() throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn ->
        stores.serviceConfig().get(conn, LOCK_KEY).map(Boolean::parseBoolean).orElse(false));
  }

  private void setLocked(boolean locked) throws SQLException {
    Transactions.autoCommit(connectionProvider, conn -> {
      stores.serviceConfig().set(conn, LOCK_KEY, Boolean.toString(locked));
      return null;
    });
    logger.log(Level.INFO, locked ? "Build queue paused" : "Build queue resumed");
  }

  public List<QueueEntry> list() throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.queue().list(conn));
  }

  public Optional<QueueEntry> find(String name, String version) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.queue().find(conn, name, version));
  }

  public boolean isQueued(String name, String version) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.queue().isQueued(conn, name, version));
  }

  /** Dequeueable entries per priority; exhausted entries are not counted. */
  public Map<Integer, Integer> pendingCountByPriority() throws SQLException {
    return Transactions.autoCommit(connectionProvider,
        conn -> stores.queue().pendingCountByPriority(conn, maxAttempts));
  }

  public int pendingCount() throws SQLException {
    int total = 0;
    for (int count : pendingCountByPriority().values()) {
      total += count;
    }
    return total;
  }

  public boolean resetAttempts(String name, String version) throws SQLException {
    return Transactions.autoCommit(connectionProvider,
        conn -> stores.queue().resetAttempts(conn, name, version)) > 0;
  }

  public boolean remove(String name, String version) throws SQLException {
    return Transactions.autoCommit(connectionProvider,
        conn -> stores.queue().remove(conn, name, version)) > 0;
  }

  public int removePackage(String name) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.queue().removePackage(conn, name));
  }

  public int deprioritizeOtherReleases(String name, String keepVersion, int priority) throws SQLException {
    return Transactions.autoCommit(connectionProvider,
        conn -> stores.queue().deprioritizeOtherReleases(conn, name, keepVersion, priority));
  }
}
