package docbuild.executor;

import docbuild.model.BuildAttempt;
import docbuild.model.BuildStatus;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.spi.MetricsExporter;
import docbuild.status.StatusAggregator;
import docbuild.util.DaemonThreadFactory;
import docbuild.util.Transactions;

import java.sql.SQLException;
import java.time.Duration;
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
 * Scheduled component that concludes build attempts left {@code in_progress}
 * by a crashed or killed worker.
 *
 * <p>An attempt is abandoned once it has run longer than the timeout its
 * package builds with (the sandbox policy timeout, or the default one) plus
 * {@code grace}. It is then marked {@code failure} and its release status is
 * recomputed. The queue entry needs no repair: its claim simply expires.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class StaleAttemptReaper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StaleAttemptReaper.class.getName());

  static final String REAPED_NOTE = "\n[attempt abandoned: no result within the time limit]\n";

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final StatusAggregator statusAggregator;
  private final SandboxLimits defaults;
  private final Duration grace;
  private final long intervalSeconds;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reapTask;
  private volatile boolean closed;

  private StaleAttemptReaper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(builder.stores, "stores");
    this.defaults = Objects.requireNonNull(builder.defaults, "defaults");
    this.grace = Objects.requireNonNull(builder.grace, "grace");
    if (grace.isNegative()) {
      throw new IllegalArgumentException("grace must be >= 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.statusAggregator = new StatusAggregator(stores);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled reaping loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("StaleAttemptReaper has been closed");
    }
    if (reapTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("docbuild-reaper-"));
    reapTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single reaping cycle. May be invoked directly for testing.
   *
   * @return number of attempts concluded
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant now = Instant.now();
      List<BuildAttempt> candidates = Transactions.autoCommit(connectionProvider,
          conn -> stores.builds().findInProgressBefore(conn, now.minus(grace)));
      int reaped = 0;
      for (BuildAttempt attempt : candidates) {
        if (reap(attempt, now)) {
          reaped++;
          metrics.incrementAttemptsReaped();
        }
      }
      if (reaped > 0) {
        logger.log(Level.WARNING, "Marked {0} abandoned build attempts as failed", reaped);
      }
      return reaped;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reaper cycle failed", t);
      return 0;
    }
  }

  private boolean reap(BuildAttempt attempt, Instant now) throws SQLException {
    String output = attempt.output() == null ? REAPED_NOTE.strip() : attempt.output() + REAPED_NOTE;
    return Transactions.inTransaction(connectionProvider, conn -> {
      Duration timeout = stores.releases().findById(conn, attempt.releaseId())
          .map(release -> SandboxLimits.resolve(defaults,
              stores.sandboxPolicies().find(conn, release.name()).orElse(null)).timeout())
          .orElse(defaults.timeout());
      if (!attempt.startedAt().plus(timeout).plus(grace).isBefore(now)) {
        return false;
      }
      int updated = stores.builds().finish(conn, attempt.id(), BuildStatus.FAILURE,
          attempt.toolchainVersion(), Instant.now(), output);
      if (updated > 0) {
        statusAggregator.recompute(conn, attempt.releaseId());
      }
      return updated > 0;
    });
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (reapTask != null) {
      reapTask.cancel(false);
      reapTask = null;
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

  /** Builder for {@link StaleAttemptReaper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DocBuildStores stores;
    private SandboxLimits defaults = SandboxLimits.DEFAULTS;
    private Duration grace = Duration.ofMinutes(5);
    private long intervalSeconds = 300;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param stores the persistence backends
     * @return this builder
     */
    public Builder stores(DocBuildStores stores) {
      this.stores = stores;
      return this;
    }

    /**
     * Sets the limits builds run with when their package has no sandbox
     * policy. Must match the executor's defaults.
     *
     * <p>Optional. Defaults to {@link SandboxLimits#DEFAULTS}.
     *
     * @param defaults default sandbox limits
     * @return this builder
     */
    public Builder defaults(SandboxLimits defaults) {
      this.defaults = defaults;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes.
     *
     * @param grace extra time before an attempt is considered abandoned
     * @return this builder
     */
    public Builder grace(Duration grace) {
      this.grace = grace;
      return this;
    }

    /**
     * Optional. Defaults to {@code 300}. Must be &gt; 0.
     *
     * @param intervalSeconds seconds between cycles
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the reaper. Call {@link StaleAttemptReaper#start()} to begin.
     *
     * @return a new {@link StaleAttemptReaper}
     */
    public StaleAttemptReaper build() {
      return new StaleAttemptReaper(this);
    }
  }
}
