package docbuild.admin;

import docbuild.model.PriorityRule;
import docbuild.model.SandboxPolicy;
import docbuild.model.SyncCheckpoint;
import docbuild.priority.Priorities;
import docbuild.priority.PriorityResolver;
import docbuild.queue.BuildQueue;
import docbuild.registry.ConsistencyChecker;
import docbuild.registry.ConsistencyReport;
import docbuild.registry.RegistryIndex;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.status.StatusAggregator;
import docbuild.util.Transactions;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative operations on the queue, the filters and the sync checkpoint.
 *
 * <p>Every operation runs on its own connection and propagates database
 * failures to the caller.
 */
public final class BuildAdmin {
  private static final Logger logger = Logger.getLogger(BuildAdmin.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final BuildQueue queue;
  private final RegistryIndex index;
  private final String checkpointName;
  private final String registry;

  /**
   * @param index may be {@code null}; operations that read the index then
   *              throw {@link IllegalStateException}
   */
  public BuildAdmin(ConnectionProvider connectionProvider, DocBuildStores stores, BuildQueue queue,
      RegistryIndex index, String checkpointName, String registry) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.index = index;
    this.checkpointName = Objects.requireNonNull(checkpointName, "checkpointName");
    this.registry = registry;
  }

  // queue

  /**
   * Queues a release at the priority of the first matching rule, or
   * {@link Priorities#DEFAULT} when none matches.
   */
  public boolean enqueue(String name, String version) throws SQLException {
    List<PriorityRule> rules = Transactions.autoCommit(connectionProvider,
        conn -> stores.priorityRules().list(conn));
    return enqueue(name, version, new PriorityResolver(rules).ruleFor(name));
  }

  /**
   * Queues a release. An already queued release keeps its priority.
   *
   * @return {@code true} if a new entry was created
   */
  public boolean enqueue(String name, String version, int priority) throws SQLException {
    return queue.enqueue(name, version, priority, registry);
  }

  public void pauseQueue() throws SQLException {
    queue.lock();
  }

  public void resumeQueue() throws SQLException {
    queue.unlock();
  }

  public boolean isQueuePaused() throws SQLException {
    return queue.isLocked();
  }

  /** Makes an exhausted entry eligible for building again. */
  public boolean resetAttempts(String name, String version) throws SQLException {
    return queue.resetAttempts(name, version);
  }

  public boolean removeFromQueue(String name, String version) throws SQLException {
    return queue.remove(name, version);
  }

  /**
   * Lowers the urgency of every other queued version of {@code name}, so that
   * only {@code keepVersion} is built soon.
   *
   * @return number of entries changed
   */
  public int deprioritizeOtherReleases(String name, String keepVersion) throws SQLException {
    return queue.deprioritizeOtherReleases(name, keepVersion, Priorities.DEPRIORITIZED);
  }

  // blacklist

  /**
   * Blacklists a package and drops its queued entries.
   *
   * @return {@code false} if it was already blacklisted
   */
  public boolean addToBlacklist(String name) throws SQLException {
    return Transactions.inTransaction(connectionProvider, conn -> {
      boolean added = stores.blacklist().add(conn, name);
      int dropped = stores.queue().removePackage(conn, name);
      if (dropped > 0) {
        logger.log(Level.INFO, "Dropped {0} queued releases of blacklisted package {1}",
            new Object[]{dropped, name});
      }
      return added;
    });
  }

  public boolean removeFromBlacklist(String name) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.blacklist().remove(conn, name));
  }

  public List<String> blacklist() throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.blacklist().list(conn));
  }

  // priority rules

  /** Appends a rule; earlier rules win when several match. */
  public PriorityRule addPriorityRule(String pattern, int priority) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.priorityRules().add(conn, pattern, priority));
  }

  public boolean removePriorityRule(String pattern) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.priorityRules().remove(conn, pattern)) > 0;
  }

  public List<PriorityRule> priorityRules() throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.priorityRules().list(conn));
  }

  // sandbox policies

  /** Stores a policy; an empty policy removes the override. */
  public void setSandboxPolicy(SandboxPolicy policy) throws SQLException {
    Objects.requireNonNull(policy, "policy");
    Transactions.autoCommit(connectionProvider, conn -> {
      if (policy.isEmpty()) {
        stores.sandboxPolicies().remove(conn, policy.packageName());
      } else {
        stores.sandboxPolicies().save(conn, policy);
      }
      return null;
    });
  }

  public boolean removeSandboxPolicy(String name) throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.sandboxPolicies().remove(conn, name)) > 0;
  }

  public List<SandboxPolicy> sandboxPolicies() throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.sandboxPolicies().list(conn));
  }

  // checkpoint

  public Optional<SyncCheckpoint> checkpoint() throws SQLException {
    return Transactions.autoCommit(connectionProvider, conn -> stores.checkpoints().find(conn, checkpointName));
  }

  /** Moves the checkpoint to {@code reference}; the next sync diffs from there. */
  public void setCheckpoint(String reference) throws SQLException {
    Objects.requireNonNull(reference, "reference");
    Transactions.autoCommit(connectionProvider, conn -> {
      stores.checkpoints().reset(conn, checkpointName, reference, Instant.now());
      return null;
    });
    logger.log(Level.WARNING, "Checkpoint {0} set to {1}", new Object[]{checkpointName, reference});
  }

  /**
   * Moves the checkpoint to the current index head, skipping every change in between.
   *
   * @return the new reference
   */
  public String resetCheckpointToHead() throws SQLException {
    String head = requireIndex().headReference();
    setCheckpoint(head);
    return head;
  }

  // repair

  public ConsistencyReport checkConsistency(boolean dryRun) throws SQLException {
    return new ConsistencyChecker(connectionProvider, stores, requireIndex(), registry).check(dryRun);
  }

  /** Recomputes every release status from its attempts. */
  public int repairStatuses() throws SQLException {
    return new StatusAggregator(stores).repairAll(connectionProvider);
  }

  /** Deletes a package with its releases, attempts and queue entries. */
  public boolean deletePackage(String name) throws SQLException {
    return Transactions.inTransaction(connectionProvider, conn -> {
      stores.queue().removePackage(conn, name);
      return stores.releases().deletePackage(conn, name) > 0;
    });
  }

  /** Deletes one release with its attempts and queue entry. */
  public boolean deleteRelease(String name, String version) throws SQLException {
    return Transactions.inTransaction(connectionProvider, conn -> {
      stores.queue().remove(conn, name, version);
      int deleted = stores.releases().deleteRelease(conn, name, version);
      stores.releases().refreshLatestRelease(conn, name);
      return deleted > 0;
    });
  }

  private RegistryIndex requireIndex() {
    if (index == null) {
      throw new IllegalStateException("No registry index configured");
    }
    return index;
  }
}
