package docbuild;

import docbuild.admin.BuildAdmin;
import docbuild.admin.BuildQueries;
import docbuild.executor.DocumentationCheck;
import docbuild.executor.Sandbox;
import docbuild.executor.SandboxExecutor;
import docbuild.executor.SandboxLimits;
import docbuild.executor.StaleAttemptReaper;
import docbuild.queue.BuildQueue;
import docbuild.queue.ExponentialBackoffRetryPolicy;
import docbuild.queue.RetryPolicy;
import docbuild.rebuild.RebuildScheduler;
import docbuild.registry.IndexSynchronizer;
import docbuild.registry.RegistryIndex;
import docbuild.registry.SyncPoller;
import docbuild.registry.SyncResult;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.spi.MetricsExporter;
import docbuild.worker.BuildWorkerPool;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires registry synchronization, build workers
 * and the background schedulers into a single {@link AutoCloseable} unit.
 *
 * <p>Three builders match the usual deployment topologies:
 * <ul>
 *   <li>{@link #combined()}: sync, workers and schedulers in one process</li>
 *   <li>{@link #watcher()}: sync and rebuild scheduling only, no builds</li>
 *   <li>{@link #buildServer()}: workers and the stale-attempt reaper only</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (DocBuild docBuild = DocBuild.combined()
 *     .connectionProvider(connectionProvider)
 *     .stores(JdbcStores.detect(dataSource))
 *     .index(registryIndex)
 *     .sandbox(sandbox)
 *     .workerCount(2)
 *     .build()) {
 *   docBuild.notifyRegistryActivity();
 * }
 * }</pre>
 */
public final class DocBuild implements AutoCloseable {

  private final BuildQueue queue;
  private final IndexSynchronizer synchronizer;
  private final SyncPoller syncPoller;
  private final BuildWorkerPool workers;
  private final StaleAttemptReaper reaper;
  private final RebuildScheduler rebuilds;
  private final BuildAdmin admin;
  private final BuildQueries queries;
  private final MetricsExporter metrics;

  private DocBuild(AbstractBuilder<?> b, IndexSynchronizer synchronizer, SyncPoller syncPoller,
      BuildWorkerPool workers, StaleAttemptReaper reaper, RebuildScheduler rebuilds) {
    this.queue = b.queue;
    this.synchronizer = synchronizer;
    this.syncPoller = syncPoller;
    this.workers = workers;
    this.reaper = reaper;
    this.rebuilds = rebuilds;
    this.metrics = b.metrics;
    String checkpointName = synchronizer != null ? synchronizer.checkpointName() : b.checkpointName;
    this.admin = new BuildAdmin(b.connectionProvider, b.stores, b.queue, b.index, checkpointName, b.registry);
    this.queries = new BuildQueries(b.connectionProvider, b.stores, b.maxAttempts);
  }

  /**
   * Requests a sync soon. Call on every registry push notification; the
   * notification content is irrelevant.
   *
   * @return {@code false} if this instance does not synchronize
   */
  public boolean notifyRegistryActivity() {
    return syncPoller != null && syncPoller.trigger();
  }

  /**
   * Runs one sync on the calling thread.
   *
   * @throws IllegalStateException if this instance does not synchronize
   */
  public SyncResult synchronizeNow() throws SQLException {
    if (synchronizer == null) {
      throw new IllegalStateException("This instance has no registry index configured");
    }
    return synchronizer.synchronize();
  }

  public BuildAdmin admin() {
    return admin;
  }

  public BuildQueries queries() {
    return queries;
  }

  public BuildQueue queue() {
    return queue;
  }

  /**
   * Shuts down components in order: rebuild scheduler, sync poller, reaper,
   * workers. Absent components are skipped.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable component : new AutoCloseable[]{rebuilds, syncPoller, reaper, workers, metricsCloseable()}) {
      if (component == null) {
        continue;
      }
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private AutoCloseable metricsCloseable() {
    return metrics instanceof AutoCloseable closeable ? closeable : null;
  }

  /** Sync, workers and schedulers in one process. */
  public static CombinedBuilder combined() {
    return new CombinedBuilder();
  }

  /** Registry watcher: synchronizes and schedules rebuilds, never builds. */
  public static WatcherBuilder watcher() {
    return new WatcherBuilder();
  }

  /** Build server: drains the shared queue, never synchronizes. */
  public static BuildServerBuilder buildServer() {
    return new BuildServerBuilder();
  }

  // ── Abstract builder ─────────────────────────────────────────────

  /**
   * Base builder with the parameters every topology shares.
   *
   * @param <B> the concrete builder type
   */
  public static abstract sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits CombinedBuilder, WatcherBuilder, BuildServerBuilder {

    ConnectionProvider connectionProvider;
    DocBuildStores stores;
    RegistryIndex index;
    MetricsExporter metrics;
    String registry;
    String checkpointName = IndexSynchronizer.DEFAULT_CHECKPOINT;
    int maxAttempts = 5;
    RetryPolicy retryPolicy;
    BuildQueue queue;
    private final AtomicBoolean built = new AtomicBoolean(false);

    // sync
    long syncIntervalMs = 60_000;
    Duration syncLockTimeout = Duration.ofMinutes(10);
    int syncBatchSize = 200;

    // workers
    Sandbox sandbox;
    SandboxLimits sandboxDefaults;
    DocumentationCheck documentationCheck;
    String builderVersion = "docbuild";
    String buildServerName;
    int workerCount = 1;
    long idleBackoffMs = 1000;
    long pausedBackoffMs = 60_000;
    long drainTimeoutMs = 30_000;
    Duration claimTimeout;
    Duration reaperGrace = Duration.ofMinutes(5);
    long reaperIntervalSeconds = 300;

    // rebuilds
    boolean rebuildsEnabled;
    int maxQueuedRebuilds = 10;
    long rebuildIntervalSeconds = 3600;

    AbstractBuilder() {}

    @SuppressWarnings("unchecked")
    B self() {
      return (B) this;
    }

    void markBuilt() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
    }

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public B connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return self();
    }

    /**
     * <b>Required.</b>
     *
     * @param stores the persistence backends
     * @return this builder
     */
    public B stores(DocBuildStores stores) {
      this.stores = stores;
      return self();
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with this
     * instance if it implements {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }

    /**
     * Optional. Registry-of-origin tag for queued releases; {@code null} for
     * the default registry.
     *
     * @param registry the registry tag
     * @return this builder
     */
    public B registry(String registry) {
      this.registry = registry;
      return self();
    }

    /**
     * Optional. Defaults to {@code "registry"}.
     *
     * @param checkpointName checkpoint row name
     * @return this builder
     */
    public B checkpointName(String checkpointName) {
      this.checkpointName = checkpointName;
      return self();
    }

    /**
     * Sets how many failed builds a queue entry may accumulate.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts attempt ceiling
     * @return this builder
     */
    public B maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return self();
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} starting at
     * one minute, capped at one hour.
     *
     * @param retryPolicy delay between failed attempts
     * @return this builder
     */
    public B retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return self();
    }

    void validateShared() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(stores, "stores");
      if (metrics == null) {
        metrics = MetricsExporter.NOOP;
      }
      queue = new BuildQueue(connectionProvider, stores,
          retryPolicy != null ? retryPolicy : new ExponentialBackoffRetryPolicy(60_000, 3_600_000),
          maxAttempts);
    }

    IndexSynchronizer buildSynchronizer() {
      Objects.requireNonNull(index, "index");
      return IndexSynchronizer.builder()
          .connectionProvider(connectionProvider)
          .stores(stores)
          .index(index)
          .checkpointName(checkpointName)
          .registry(registry)
          .lockTimeout(syncLockTimeout)
          .batchSize(syncBatchSize)
          .metrics(metrics)
          .build();
    }

    SyncPoller buildSyncPoller(IndexSynchronizer synchronizer) {
      return SyncPoller.builder()
          .synchronizer(synchronizer)
          .intervalMs(syncIntervalMs)
          .metrics(metrics)
          .build();
    }

    SandboxExecutor buildExecutor() {
      Objects.requireNonNull(sandbox, "sandbox");
      SandboxExecutor.Builder eb = SandboxExecutor.builder()
          .connectionProvider(connectionProvider)
          .stores(stores)
          .sandbox(sandbox)
          .builderVersion(builderVersion)
          .metrics(metrics);
      if (sandboxDefaults != null) {
        eb.defaults(sandboxDefaults);
      }
      if (documentationCheck != null) {
        eb.documentationCheck(documentationCheck);
      }
      if (buildServerName != null) {
        eb.buildServer(buildServerName);
      }
      return eb.build();
    }

    BuildWorkerPool buildWorkers(SandboxExecutor executor) {
      return BuildWorkerPool.builder()
          .queue(queue)
          .executor(executor)
          .workerCount(workerCount)
          .idleBackoffMs(idleBackoffMs)
          .pausedBackoffMs(pausedBackoffMs)
          .drainTimeoutMs(drainTimeoutMs)
          .claimTimeout(claimTimeout)
          .metrics(metrics)
          .build();
    }

    StaleAttemptReaper buildReaper(SandboxExecutor executor) {
      return StaleAttemptReaper.builder()
          .connectionProvider(connectionProvider)
          .stores(stores)
          .defaults(executor.defaults())
          .grace(reaperGrace)
          .intervalSeconds(reaperIntervalSeconds)
          .metrics(metrics)
          .build();
    }

    RebuildScheduler buildRebuilds() {
      if (!rebuildsEnabled) {
        return null;
      }
      return RebuildScheduler.builder()
          .connectionProvider(connectionProvider)
          .stores(stores)
          .maxQueuedRebuilds(maxQueuedRebuilds)
          .intervalSeconds(rebuildIntervalSeconds)
          .registry(registry)
          .build();
    }

    /**
     * Assembles and starts the components. Components already started are
     * closed again if a later one fails to start.
     */
    DocBuild assemble(boolean sync, boolean build, boolean rebuild) {
      markBuilt();
      validateShared();
      IndexSynchronizer synchronizer = sync ? buildSynchronizer() : null;
      SyncPoller poller = sync ? buildSyncPoller(synchronizer) : null;
      SandboxExecutor executor = build ? buildExecutor() : null;
      BuildWorkerPool pool = build ? buildWorkers(executor) : null;
      StaleAttemptReaper reaper = build ? buildReaper(executor) : null;
      RebuildScheduler rebuildScheduler = rebuild ? buildRebuilds() : null;

      DocBuild docBuild = new DocBuild(this, synchronizer, poller, pool, reaper, rebuildScheduler);
      List<Runnable> starters = new ArrayList<>();
      if (poller != null) starters.add(poller::start);
      if (reaper != null) starters.add(reaper::start);
      if (pool != null) starters.add(pool::start);
      if (rebuildScheduler != null) starters.add(rebuildScheduler::start);
      try {
        starters.forEach(Runnable::run);
      } catch (RuntimeException e) {
        try {
          docBuild.close();
        } catch (RuntimeException closeFailure) {
          e.addSuppressed(closeFailure);
        }
        throw e;
      }
      return docBuild;
    }

    public abstract DocBuild build();
  }

  // ── Combined builder ─────────────────────────────────────────────

  /** Builder for a single process that synchronizes and builds. */
  public static final class CombinedBuilder extends AbstractBuilder<CombinedBuilder> {
    CombinedBuilder() {}

    /** <b>Required.</b> */
    public CombinedBuilder index(RegistryIndex index) {
      this.index = index;
      return this;
    }

    /** <b>Required.</b> */
    public CombinedBuilder sandbox(Sandbox sandbox) {
      this.sandbox = sandbox;
      return this;
    }

    public CombinedBuilder syncIntervalMs(long syncIntervalMs) {
      this.syncIntervalMs = syncIntervalMs;
      return this;
    }

    public CombinedBuilder syncLockTimeout(Duration syncLockTimeout) {
      this.syncLockTimeout = syncLockTimeout;
      return this;
    }

    public CombinedBuilder syncBatchSize(int syncBatchSize) {
      this.syncBatchSize = syncBatchSize;
      return this;
    }

    public CombinedBuilder sandboxDefaults(SandboxLimits sandboxDefaults) {
      this.sandboxDefaults = sandboxDefaults;
      return this;
    }

    public CombinedBuilder documentationCheck(DocumentationCheck documentationCheck) {
      this.documentationCheck = documentationCheck;
      return this;
    }

    public CombinedBuilder builderVersion(String builderVersion) {
      this.builderVersion = builderVersion;
      return this;
    }

    public CombinedBuilder buildServerName(String buildServerName) {
      this.buildServerName = buildServerName;
      return this;
    }

    /** Optional. Defaults to {@code 1}. */
    public CombinedBuilder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public CombinedBuilder idleBackoffMs(long idleBackoffMs) {
      this.idleBackoffMs = idleBackoffMs;
      return this;
    }

    public CombinedBuilder pausedBackoffMs(long pausedBackoffMs) {
      this.pausedBackoffMs = pausedBackoffMs;
      return this;
    }

    public CombinedBuilder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Fixed claim lifetime. Unset, claims outlive the longest timeout of the
     * sandbox defaults and all sandbox policies by 5 minutes.
     */
    public CombinedBuilder claimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
      return this;
    }

    public CombinedBuilder reaper(Duration grace, long intervalSeconds) {
      this.reaperGrace = grace;
      this.reaperIntervalSeconds = intervalSeconds;
      return this;
    }

    /** Enables continuous rebuilds. Disabled by default. */
    public CombinedBuilder rebuilds(int maxQueuedRebuilds, long intervalSeconds) {
      this.rebuildsEnabled = true;
      this.maxQueuedRebuilds = maxQueuedRebuilds;
      this.rebuildIntervalSeconds = intervalSeconds;
      return this;
    }

    @Override
    public DocBuild build() {
      return assemble(true, true, true);
    }
  }

  // ── Watcher builder ──────────────────────────────────────────────

  /** Builder for a registry watcher that never builds. */
  public static final class WatcherBuilder extends AbstractBuilder<WatcherBuilder> {
    WatcherBuilder() {}

    /** <b>Required.</b> */
    public WatcherBuilder index(RegistryIndex index) {
      this.index = index;
      return this;
    }

    public WatcherBuilder syncIntervalMs(long syncIntervalMs) {
      this.syncIntervalMs = syncIntervalMs;
      return this;
    }

    public WatcherBuilder syncLockTimeout(Duration syncLockTimeout) {
      this.syncLockTimeout = syncLockTimeout;
      return this;
    }

    public WatcherBuilder syncBatchSize(int syncBatchSize) {
      this.syncBatchSize = syncBatchSize;
      return this;
    }

    /** Enables continuous rebuilds. Disabled by default. */
    public WatcherBuilder rebuilds(int maxQueuedRebuilds, long intervalSeconds) {
      this.rebuildsEnabled = true;
      this.maxQueuedRebuilds = maxQueuedRebuilds;
      this.rebuildIntervalSeconds = intervalSeconds;
      return this;
    }

    @Override
    public DocBuild build() {
      return assemble(true, false, true);
    }
  }

  // ── Build server builder ─────────────────────────────────────────

  /** Builder for a build server draining a shared queue. */
  public static final class BuildServerBuilder extends AbstractBuilder<BuildServerBuilder> {
    BuildServerBuilder() {}

    /**
     * Optional. Only needed for {@link BuildAdmin#resetCheckpointToHead()} and
     * {@link BuildAdmin#checkConsistency(boolean)}.
     */
    public BuildServerBuilder index(RegistryIndex index) {
      this.index = index;
      return this;
    }

    /** <b>Required.</b> */
    public BuildServerBuilder sandbox(Sandbox sandbox) {
      this.sandbox = sandbox;
      return this;
    }

    public BuildServerBuilder sandboxDefaults(SandboxLimits sandboxDefaults) {
      this.sandboxDefaults = sandboxDefaults;
      return this;
    }

    public BuildServerBuilder documentationCheck(DocumentationCheck documentationCheck) {
      this.documentationCheck = documentationCheck;
      return this;
    }

    public BuildServerBuilder builderVersion(String builderVersion) {
      this.builderVersion = builderVersion;
      return this;
    }

    public BuildServerBuilder buildServerName(String buildServerName) {
      this.buildServerName = buildServerName;
      return this;
    }

    /** Optional. Defaults to {@code 1}. */
    public BuildServerBuilder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public BuildServerBuilder idleBackoffMs(long idleBackoffMs) {
      this.idleBackoffMs = idleBackoffMs;
      return this;
    }

    public BuildServerBuilder pausedBackoffMs(long pausedBackoffMs) {
      this.pausedBackoffMs = pausedBackoffMs;
      return this;
    }

    public BuildServerBuilder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Fixed claim lifetime. Unset, claims outlive the longest timeout of the
     * sandbox defaults and all sandbox policies by 5 minutes.
     */
    public BuildServerBuilder claimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
      return this;
    }

    public BuildServerBuilder reaper(Duration grace, long intervalSeconds) {
      this.reaperGrace = grace;
      this.reaperIntervalSeconds = intervalSeconds;
      return this;
    }

    @Override
    public DocBuild build() {
      return assemble(false, true, false);
    }
  }
}
