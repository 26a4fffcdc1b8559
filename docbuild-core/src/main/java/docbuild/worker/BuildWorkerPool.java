package docbuild.worker;

import docbuild.executor.BuildReport;
import docbuild.executor.BuildRequest;
import docbuild.executor.SandboxExecutor;
import docbuild.executor.SandboxUnavailableException;
import docbuild.model.QueueEntry;
import docbuild.queue.BuildQueue;
import docbuild.spi.MetricsExporter;
import docbuild.util.DaemonThreadFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pool of build workers draining the {@link BuildQueue}.
 *
 * <p>Each worker loops: back off while the queue is paused; otherwise claim
 * the most urgent entry, build it with the {@link SandboxExecutor} and record
 * the outcome on the entry. When the sandbox is unavailable the claim is
 * released without consuming an attempt. Workers on any number of hosts may
 * share one queue; the claim guarantees each entry is built by one worker at a time.
 *
 * <p>Create instances via {@link #builder()}. Call {@link #start()} to launch
 * the workers; {@link #close()} stops claiming and waits up to the drain
 * timeout for running builds.
 */
public final class BuildWorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BuildWorkerPool.class.getName());

  /** What one iteration of a worker did. */
  public enum Step {
    PAUSED,
    IDLE,
    SUCCEEDED,
    FAILED,
    EXHAUSTED,
    RELEASED
  }

  private final BuildQueue queue;
  private final SandboxExecutor executor;
  private final int workerCount;
  private final long idleBackoffMs;
  private final long pausedBackoffMs;
  private final Duration claimTimeout;
  private final long drainTimeoutMs;
  private final String ownerPrefix;
  private final MetricsExporter metrics;
  static final Duration CLAIM_MARGIN = Duration.ofMinutes(5);

  private final AtomicBoolean running = new AtomicBoolean(false);

  private ExecutorService workers;
  private volatile boolean closed;

  private BuildWorkerPool(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.executor = Objects.requireNonNull(builder.executor, "executor");
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.idleBackoffMs <= 0 || builder.pausedBackoffMs <= 0) {
      throw new IllegalArgumentException("backoff intervals must be > 0");
    }
    this.workerCount = builder.workerCount;
    this.idleBackoffMs = builder.idleBackoffMs;
    this.pausedBackoffMs = builder.pausedBackoffMs;
    if (builder.claimTimeout != null && (builder.claimTimeout.isNegative() || builder.claimTimeout.isZero())) {
      throw new IllegalArgumentException("claimTimeout must be positive");
    }
    this.claimTimeout = builder.claimTimeout;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.ownerPrefix = builder.ownerPrefix != null
        ? builder.ownerPrefix : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Launches the worker threads. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("BuildWorkerPool has been closed");
    }
    if (workers != null) {
      return;
    }
    running.set(true);
    if (workerCount == 0) {
      logger.warning("workerCount=0: no build workers started; queued releases will not be built");
      return;
    }
    workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("docbuild-worker-"));
    for (int i = 1; i <= workerCount; i++) {
      String ownerId = ownerPrefix + "-" + i;
      workers.submit(() -> workerLoop(ownerId));
    }
  }

  private void workerLoop(String ownerId) {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        Step step = processNext(ownerId);
        if (step == Step.PAUSED) {
          Thread.sleep(pausedBackoffMs);
        } else if (step == Step.IDLE || step == Step.RELEASED) {
          Thread.sleep(idleBackoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Build worker " + ownerId + " loop error", t);
        sleepQuietly(idleBackoffMs);
      }
    }
  }

  /**
   * Runs one worker iteration as {@code ownerId}. Called by the worker threads,
   * but may also be invoked directly for testing.
   */
  public Step processNext(String ownerId) throws SQLException {
    if (queue.isLocked()) {
      return Step.PAUSED;
    }
    Optional<QueueEntry> claimed = queue.claimNext(ownerId, claimTimeout());
    if (claimed.isEmpty()) {
      metrics.recordQueueDepth(queue.pendingCount());
      return Step.IDLE;
    }
    QueueEntry entry = claimed.get();
    Step step = build(entry);
    metrics.recordQueueDepth(queue.pendingCount());
    return step;
  }

  /**
   * A claim outlives the longest build any package may run, so no entry is
   * taken over while its build can still be running.
   */
  private Duration claimTimeout() throws SQLException {
    return claimTimeout != null ? claimTimeout : executor.longestBuildTime().plus(CLAIM_MARGIN);
  }

  private Step build(QueueEntry entry) throws SQLException {
    BuildReport report;
    try {
      report = executor.execute(new BuildRequest(entry.name(), entry.version(), entry.registry()));
    } catch (SandboxUnavailableException e) {
      logger.log(Level.WARNING, "Sandbox unavailable for " + entry.name() + " " + entry.version()
          + "; returning it to the queue", e);
      queue.release(entry);
      return Step.RELEASED;
    } catch (SQLException | RuntimeException e) {
      queue.release(entry);
      throw e;
    }
    if (report.successful()) {
      queue.recordSuccess(entry);
      return Step.SUCCEEDED;
    }
    if (queue.recordFailure(entry)) {
      metrics.incrementAttemptsExhausted();
      logger.log(Level.WARNING, "{0} {1} failed {2} times; it will not be retried until reset",
          new Object[]{entry.name(), entry.version(), queue.maxAttempts()});
      return Step.EXHAUSTED;
    }
    return Step.FAILED;
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Stops claiming new entries and waits up to the drain timeout for running
   * builds, then interrupts them.
   */
  @Override
  public synchronized void close() {
    closed = true;
    running.set(false);
    if (workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting running builds");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link BuildWorkerPool}. */
  public static final class Builder {
    private BuildQueue queue;
    private SandboxExecutor executor;
    private int workerCount = 1;
    private long idleBackoffMs = 1000;
    private long pausedBackoffMs = 60_000;
    private Duration claimTimeout;
    private long drainTimeoutMs = 30_000;
    private String ownerPrefix;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param queue the queue to drain
     * @return this builder
     */
    public Builder queue(BuildQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param executor runs the builds
     * @return this builder
     */
    public Builder executor(SandboxExecutor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the number of concurrent builds on this host.
     *
     * <p>Optional. Defaults to {@code 1}. {@code 0} starts no workers.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000} ms.
     *
     * @param idleBackoffMs sleep when the queue has nothing to claim
     * @return this builder
     */
    public Builder idleBackoffMs(long idleBackoffMs) {
      this.idleBackoffMs = idleBackoffMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 60000} ms.
     *
     * @param pausedBackoffMs sleep while the queue is paused
     * @return this builder
     */
    public Builder pausedBackoffMs(long pausedBackoffMs) {
      this.pausedBackoffMs = pausedBackoffMs;
      return this;
    }

    /**
     * Sets how long a claim is honoured before another worker may take the
     * entry over. Must exceed the longest build.
     *
     * <p>Optional. Defaults to the longest timeout of the executor's defaults
     * and all sandbox policies, plus 5 minutes, looked up at every claim.
     *
     * @param claimTimeout claim expiry
     * @return this builder
     */
    public Builder claimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30000} ms.
     *
     * @param drainTimeoutMs time to wait for running builds on close
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to a random {@code worker-xxxxxxxx}; worker threads
     * append {@code -1}, {@code -2}, ...
     *
     * @param ownerPrefix claim owner prefix
     * @return this builder
     */
    public Builder ownerPrefix(String ownerPrefix) {
      this.ownerPrefix = ownerPrefix;
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

    public BuildWorkerPool build() {
      return new BuildWorkerPool(this);
    }
  }
}
