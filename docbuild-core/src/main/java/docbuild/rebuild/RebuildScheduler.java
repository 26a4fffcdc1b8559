package docbuild.rebuild;

import docbuild.model.QueueEntry;
import docbuild.model.Release;
import docbuild.priority.BlacklistFilter;
import docbuild.priority.Priorities;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.util.DaemonThreadFactory;
import docbuild.util.Transactions;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps documentation fresh by periodically queueing rebuilds of the latest
 * release of each successfully documented package, least recently built first.
 *
 * <p>Rebuilds use {@link Priorities#CONTINUOUS}, below every other kind of work.
 * No more than {@code maxQueuedRebuilds} entries at that priority or lower
 * urgency are kept in the queue; releases already queued are left alone.
 */
public final class RebuildScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RebuildScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final int maxQueuedRebuilds;
  private final long intervalSeconds;
  private final String registry;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private RebuildScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(builder.stores, "stores");
    if (builder.maxQueuedRebuilds < 1) {
      throw new IllegalArgumentException("maxQueuedRebuilds must be >= 1");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.maxQueuedRebuilds = builder.maxQueuedRebuilds;
    this.intervalSeconds = builder.intervalSeconds;
    this.registry = builder.registry;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RebuildScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("docbuild-rebuilds-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Tops the queue up with rebuilds. May be invoked directly for testing.
   *
   * @return number of rebuilds queued
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int queued = Transactions.inTransaction(connectionProvider, conn -> {
        int alreadyQueued = 0;
        for (QueueEntry entry : stores.queue().list(conn)) {
          if (entry.priority() >= Priorities.CONTINUOUS) {
            alreadyQueued++;
          }
        }
        int room = maxQueuedRebuilds - alreadyQueued;
        if (room <= 0) {
          return 0;
        }
        BlacklistFilter blacklist = new BlacklistFilter(stores.blacklist().list(conn));
        List<Release> candidates = stores.releases().latestDocumentedReleases(conn, room + alreadyQueued);
        Instant now = Instant.now();
        int added = 0;
        for (Release release : candidates) {
          if (added >= room) {
            break;
          }
          if (blacklist.isBlacklisted(release.name())) {
            continue;
          }
          if (stores.queue().enqueue(conn, release.name(), release.version(),
              Priorities.CONTINUOUS, registry, now)) {
            added++;
          }
        }
        return added;
      });
      if (queued > 0) {
        logger.log(Level.INFO, "Queued {0} rebuilds", queued);
      }
      return queued;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Rebuild cycle failed", t);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RebuildScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DocBuildStores stores;
    private int maxQueuedRebuilds = 10;
    private long intervalSeconds = 3600;
    private String registry;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder stores(DocBuildStores stores) {
      this.stores = stores;
      return this;
    }

    /** Optional. Defaults to {@code 10}. */
    public Builder maxQueuedRebuilds(int maxQueuedRebuilds) {
      this.maxQueuedRebuilds = maxQueuedRebuilds;
      return this;
    }

    /** Optional. Defaults to {@code 3600} seconds. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /** Optional. Registry-of-origin tag for queued rebuilds. */
    public Builder registry(String registry) {
      this.registry = registry;
      return this;
    }

    public RebuildScheduler build() {
      return new RebuildScheduler(this);
    }
  }
}
