package docbuild.executor;

import docbuild.model.BuildAttempt;
import docbuild.model.BuildOutputs;
import docbuild.model.BuildStatus;
import docbuild.model.Release;
import docbuild.model.SandboxPolicy;
import docbuild.spi.ConnectionProvider;
import docbuild.spi.DocBuildStores;
import docbuild.spi.MetricsExporter;
import docbuild.status.StatusAggregator;
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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one documentation build for a release inside a {@link Sandbox} and
 * records it as exactly one build attempt.
 *
 * <p>The attempt row is committed as {@code in_progress} before any build work
 * starts. The default target is built first; the remaining requested targets
 * follow, up to the resolved target limit, while wall-clock budget remains.
 * Finishing the attempt, storing the build outputs and recomputing the release
 * status happen in one transaction.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SandboxExecutor {
  private static final Logger logger = Logger.getLogger(SandboxExecutor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DocBuildStores stores;
  private final Sandbox sandbox;
  private final SandboxLimits defaults;
  private final DocumentationCheck documentationCheck;
  private final StatusAggregator statusAggregator;
  private final String builderVersion;
  private final String buildServer;
  private final long logFlushIntervalMs;
  private final MetricsExporter metrics;

  private SandboxExecutor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(builder.stores, "stores");
    this.sandbox = Objects.requireNonNull(builder.sandbox, "sandbox");
    this.defaults = builder.defaults != null ? builder.defaults : SandboxLimits.DEFAULTS;
    this.documentationCheck = builder.documentationCheck != null
        ? builder.documentationCheck : DocumentationCheck.DEFAULT;
    this.builderVersion = Objects.requireNonNull(builder.builderVersion, "builderVersion");
    this.buildServer = builder.buildServer != null ? builder.buildServer : defaultBuildServer();
    if (builder.logFlushIntervalMs <= 0) {
      throw new IllegalArgumentException("logFlushIntervalMs must be > 0");
    }
    this.logFlushIntervalMs = builder.logFlushIntervalMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.statusAggregator = new StatusAggregator(stores);
  }

  public static Builder builder() {
    return new Builder();
  }

  public SandboxLimits defaults() {
    return defaults;
  }

  /** Limits a build of {@code name} would run with right now. */
  public SandboxLimits limitsFor(Connection conn, String name) {
    return SandboxLimits.resolve(defaults, stores.sandboxPolicies().find(conn, name).orElse(null));
  }

  /**
   * Longest wall-clock time any build may run: the default timeout or the
   * largest policy timeout, whichever is longer.
   */
  public Duration longestBuildTime() throws SQLException {
    return longestBuildTime(connectionProvider, stores, defaults);
  }

  static Duration longestBuildTime(ConnectionProvider connectionProvider, DocBuildStores stores,
      SandboxLimits defaults) throws SQLException {
    List<SandboxPolicy> policies = Transactions.autoCommit(connectionProvider,
        conn -> stores.sandboxPolicies().list(conn));
    Duration longest = defaults.timeout();
    for (SandboxPolicy policy : policies) {
      Duration timeout = SandboxLimits.resolve(defaults, policy).timeout();
      if (timeout.compareTo(longest) > 0) {
        longest = timeout;
      }
    }
    return longest;
  }

  /**
   * Builds {@code request}.
   *
   * @return the recorded outcome; build failures are reported here, not thrown
   * @throws SandboxUnavailableException if the sandbox cannot run the build.
   *     Thrown before any attempt is recorded when preparation fails; thrown
   *     after concluding the attempt as {@code failure} when the sandbox goes
   *     away mid-build
   * @throws SQLException if the database is unavailable
   */
  public BuildReport execute(BuildRequest request) throws SQLException {
    SandboxLimits limits = Transactions.autoCommit(connectionProvider, conn -> limitsFor(conn, request.name()));

    sandbox.prepare(request, limits);
    String toolchain = sandbox.toolchainVersion();

    Instant startedAt = Instant.now();
    long[] ids = Transactions.inTransaction(connectionProvider, conn -> {
      long releaseId = stores.releases().ensureRelease(conn, request.name(), request.version());
      stores.releases().refreshLatestRelease(conn, request.name());
      long buildId = stores.builds().insertInProgress(conn, releaseId, builderVersion, buildServer, startedAt);
      statusAggregator.recompute(conn, releaseId);
      return new long[]{releaseId, buildId};
    });
    long releaseId = ids[0];
    long buildId = ids[1];

    BuildLog log = new BuildLog(limits.maxLogBytes(), logFlushIntervalMs, text -> flushLog(buildId, text));
    log.line("building " + request.name() + " " + request.version() + " with " + toolchain
        + " (memory=" + limits.memoryBytes() + ", timeout=" + limits.timeout()
        + ", max targets=" + limits.maxTargets() + ")");

    Attempt attempt = new Attempt();
    SandboxUnavailableException unavailable = null;
    try {
      run(request, releaseId, limits, startedAt, log, attempt);
    } catch (SandboxUnavailableException e) {
      logger.log(Level.WARNING, "Sandbox went away while building " + request.name() + " " + request.version(), e);
      log.line("build aborted: sandbox unavailable: " + e.getMessage());
      attempt.aborted = true;
      unavailable = e;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Build of " + request.name() + " " + request.version() + " aborted", e);
      log.line("build aborted: " + e);
      attempt.aborted = true;
    } finally {
      cleanup(request);
    }

    boolean success = !attempt.aborted && !attempt.timedOut && !attempt.memoryExceeded
        && attempt.metadata != null
        && documentationCheck.succeeded(attempt.metadata, attempt.defaultResult(), attempt.results);
    BuildStatus computed = success ? BuildStatus.SUCCESS : BuildStatus.FAILURE;
    Instant finishedAt = Instant.now();

    BuildStatus status = Transactions.inTransaction(connectionProvider, conn -> {
      BuildStatus stored = computed;
      int finished = stores.builds().finish(conn, buildId, computed, toolchain, finishedAt, log.contents());
      if (finished == 0) {
        stored = stores.builds().find(conn, buildId).map(BuildAttempt::status).orElse(BuildStatus.FAILURE);
        logger.log(Level.WARNING, "Build {0} was concluded as {1} by someone else; keeping that result",
            new Object[]{buildId, stored.code()});
      } else if (attempt.metadata != null) {
        stores.releases().recordBuildOutputs(conn, releaseId, attempt.outputs());
      }
      statusAggregator.recompute(conn, releaseId);
      return stored;
    });
    if (unavailable != null) {
      metrics.incrementBuildFailure();
      throw unavailable;
    }

    Duration duration = Duration.between(startedAt, finishedAt);
    record(status, attempt, duration);
    logger.log(Level.INFO, "Built {0} {1}: {2} in {3}s ({4} targets)",
        new Object[]{request.name(), request.version(), status.code(), duration.toSeconds(),
            attempt.results.size()});
    return new BuildReport(buildId, releaseId, status, toolchain, attempt.results,
        attempt.timedOut, attempt.memoryExceeded, duration);
  }

  private void run(BuildRequest request, long releaseId, SandboxLimits limits, Instant startedAt,
      BuildLog log, Attempt attempt) throws SQLException {
    PackageMetadata inspected = sandbox.inspect(request, limits, log);
    Optional<Release> release = Transactions.autoCommit(connectionProvider,
        conn -> stores.releases().findById(conn, releaseId));
    attempt.metadata = withRecordedFacts(inspected, release.orElse(null));

    List<String> targets = targetsToBuild(attempt.metadata, limits, log);
    Instant deadline = startedAt.plus(limits.timeout());
    for (String target : targets) {
      Duration budget = Duration.between(Instant.now(), deadline);
      if (budget.isNegative() || budget.isZero()) {
        log.line("time limit of " + limits.timeout() + " reached before " + target);
        attempt.results.add(TargetResult.timedOut(target));
        attempt.timedOut = true;
        return;
      }
      log.line("building target " + target);
      TargetResult result = sandbox.build(request, target, limits, budget, log);
      attempt.results.add(result);
      if (result.timedOut()) {
        log.line("target " + target + " exceeded the time limit and was killed");
        attempt.timedOut = true;
        return;
      }
      if (result.memoryExceeded()) {
        log.line("target " + target + " exceeded the memory limit of " + limits.memoryBytes() + " bytes");
        attempt.memoryExceeded = true;
        return;
      }
      if (attempt.results.size() == 1 && !result.successful()) {
        log.line("default target failed; skipping remaining targets");
        return;
      }
    }
  }

  /** A library flag recorded at sync time wins over what the sandbox found. */
  private static PackageMetadata withRecordedFacts(PackageMetadata inspected, Release release) {
    if (release == null) {
      return inspected;
    }
    boolean library = release.library() != null ? release.library() : inspected.library();
    List<String> targets = release.targets().isEmpty() ? inspected.targets() : release.targets();
    return new PackageMetadata(library, inspected.defaultTarget(), targets);
  }

  private static List<String> targetsToBuild(PackageMetadata metadata, SandboxLimits limits, BuildLog log) {
    Set<String> ordered = new LinkedHashSet<>();
    ordered.add(metadata.defaultTarget());
    ordered.addAll(metadata.targets());
    List<String> all = new ArrayList<>(ordered);
    if (all.size() <= limits.maxTargets()) {
      return all;
    }
    List<String> skipped = all.subList(limits.maxTargets(), all.size());
    log.line("target limit " + limits.maxTargets() + " reached; skipping " + String.join(", ", skipped));
    return new ArrayList<>(all.subList(0, limits.maxTargets()));
  }

  private void flushLog(long buildId, String text) {
    try {
      Transactions.autoCommit(connectionProvider, conn -> stores.builds().updateOutput(conn, buildId, text));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to flush log of build " + buildId, e);
    }
  }

  private void cleanup(BuildRequest request) {
    try {
      sandbox.cleanup(request);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Sandbox cleanup failed for " + request.name() + " " + request.version(), e);
    }
  }

  private void record(BuildStatus status, Attempt attempt, Duration duration) {
    if (status == BuildStatus.SUCCESS) {
      metrics.incrementBuildSuccess();
    } else {
      metrics.incrementBuildFailure();
    }
    if (attempt.timedOut) {
      metrics.incrementBuildTimeout();
    }
    metrics.recordBuildDurationMs(duration.toMillis());
  }

  private static String defaultBuildServer() {
    String host = System.getenv("HOSTNAME");
    return host != null && !host.isBlank() ? host : "unknown";
  }

  private static final class Attempt {
    PackageMetadata metadata;
    final List<TargetResult> results = new ArrayList<>();
    boolean timedOut;
    boolean memoryExceeded;
    boolean aborted;

    TargetResult defaultResult() {
      return results.isEmpty() ? null : results.get(0);
    }

    BuildOutputs outputs() {
      TargetResult first = defaultResult();
      List<String> docTargets = new ArrayList<>();
      for (TargetResult result : results) {
        if (result.successful() && result.docsProduced()) {
          docTargets.add(result.target());
        }
      }
      boolean hasDocs = first != null && first.successful() && first.docsProduced();
      return new BuildOutputs(metadata.library(), metadata.defaultTarget(), docTargets, hasDocs,
          first != null ? first.documentedItems() : null,
          first != null ? first.totalItems() : null);
    }
  }

  /** Builder for {@link SandboxExecutor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DocBuildStores stores;
    private Sandbox sandbox;
    private SandboxLimits defaults;
    private DocumentationCheck documentationCheck;
    private String builderVersion = "docbuild";
    private String buildServer;
    private long logFlushIntervalMs = 10_000;
    private MetricsExporter metrics;

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

    /** <b>Required.</b> */
    public Builder sandbox(Sandbox sandbox) {
      this.sandbox = sandbox;
      return this;
    }

    /**
     * Sets the limits applied when a package has no sandbox policy.
     *
     * <p>Optional. Defaults to {@link SandboxLimits#DEFAULTS}.
     */
    public Builder defaults(SandboxLimits defaults) {
      this.defaults = defaults;
      return this;
    }

    /**
     * Optional. Defaults to {@link DocumentationCheck#DEFAULT}.
     */
    public Builder documentationCheck(DocumentationCheck documentationCheck) {
      this.documentationCheck = documentationCheck;
      return this;
    }

    /** Optional. Stored on each attempt; defaults to {@code "docbuild"}. */
    public Builder builderVersion(String builderVersion) {
      this.builderVersion = builderVersion;
      return this;
    }

    /** Optional. Defaults to the {@code HOSTNAME} environment variable. */
    public Builder buildServer(String buildServer) {
      this.buildServer = buildServer;
      return this;
    }

    /** Optional. Defaults to {@code 10000} ms. */
    public Builder logFlushIntervalMs(long logFlushIntervalMs) {
      this.logFlushIntervalMs = logFlushIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SandboxExecutor build() {
      return new SandboxExecutor(this);
    }
  }
}
