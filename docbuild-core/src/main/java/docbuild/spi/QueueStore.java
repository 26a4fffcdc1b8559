package docbuild.spi;

import docbuild.model.QueueEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for the build queue.
 *
 * <p>All methods operate on a caller-supplied {@link Connection}; the caller
 * owns transaction boundaries. Name arguments are matched case- and
 * separator-insensitively unless stated otherwise.
 */
public interface QueueStore {

  /**
   * Idempotent upsert of a queue entry. An existing entry keeps its priority
   * and attempt count; only its registry of origin is refreshed.
   *
   * @return {@code true} if a new entry was created
   */
  boolean enqueue(Connection conn, String name, String version, int priority, String registry, Instant now);

  /**
   * Claims the most urgent eligible entry for {@code ownerId}. Ordering is
   * priority ascending, then insertion order. Entries at or above
   * {@code maxAttempts}, entries not yet available again, and entries claimed
   * by a live owner are skipped. At most one caller can win a given entry.
   *
   * @param lockExpiry claims older than this are considered abandoned
   */
  Optional<QueueEntry> claimNext(Connection conn, String ownerId, Instant now, Instant lockExpiry, int maxAttempts);

  /**
   * Deletes entries for which a successful build finished after the entry was queued.
   *
   * @return number of entries removed
   */
  int pruneCompleted(Connection conn);

  /** Removes a successfully built entry. */
  int markSucceeded(Connection conn, long entryId);

  /**
   * Records a failed attempt: increments the attempt counter, stamps
   * {@code last_attempt}, defers the entry until {@code availableAt} and
   * releases the claim.
   */
  int markFailed(Connection conn, long entryId, Instant now, Instant availableAt);

  /** Releases a claim without consuming an attempt. */
  int releaseClaim(Connection conn, long entryId);

  boolean isQueued(Connection conn, String name, String version);

  Optional<QueueEntry> find(Connection conn, String name, String version);

  /** All entries in dequeue order, including exhausted ones. */
  List<QueueEntry> list(Connection conn);

  /** Counts of dequeueable entries (below {@code maxAttempts}) keyed by priority. */
  Map<Integer, Integer> pendingCountByPriority(Connection conn, int maxAttempts);

  /** Clears the attempt counter and retry delay of one entry. */
  int resetAttempts(Connection conn, String name, String version);

  int remove(Connection conn, String name, String version);

  int removePackage(Connection conn, String name);

  /**
   * Raises every other queued version of a package to at least {@code priority}.
   */
  int deprioritizeOtherReleases(Connection conn, String name, String keepVersion, int priority);
}
