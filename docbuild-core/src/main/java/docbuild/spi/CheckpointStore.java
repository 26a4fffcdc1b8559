package docbuild.spi;

import docbuild.model.SyncCheckpoint;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence contract for synchronization checkpoints.
 *
 * <p>A checkpoint row carries a version counter for compare-and-swap advances
 * and a lock owner for the mutating phase of a sync.
 */
public interface CheckpointStore {

  /**
   * Returns the checkpoint, or empty if no reference has been recorded yet.
   */
  Optional<SyncCheckpoint> find(Connection conn, String name);

  /**
   * Acquires the checkpoint lock for {@code ownerId}, creating the row if
   * needed. A lock held by another owner is taken over only once it is older
   * than {@code lockExpiry}.
   *
   * @return {@code true} if the lock is now held by {@code ownerId}
   */
  boolean tryLock(Connection conn, String name, String ownerId, Instant now, Instant lockExpiry);

  void unlock(Connection conn, String name, String ownerId);

  /**
   * Advances the reference only if the stored version still equals
   * {@code expectedVersion}. Use {@code -1} when no reference existed.
   *
   * @return {@code true} if the swap happened
   */
  boolean compareAndSet(Connection conn, String name, long expectedVersion, String reference, Instant now);

  /** Unconditionally sets the reference (administrative override). */
  void reset(Connection conn, String name, String reference, Instant now);
}
