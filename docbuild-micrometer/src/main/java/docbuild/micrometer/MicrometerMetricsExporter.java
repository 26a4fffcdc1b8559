package docbuild.micrometer;

import docbuild.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code docbuild.sync.runs} and {@code docbuild.sync.failures}</li>
 *   <li>{@code docbuild.queue.enqueued}: entries created by sync, admin or rebuilds</li>
 *   <li>{@code docbuild.queue.blacklist.skipped}</li>
 *   <li>{@code docbuild.build.success}, {@code docbuild.build.failure}, {@code docbuild.build.timeout}</li>
 *   <li>{@code docbuild.queue.exhausted}: entries that reached the attempt ceiling</li>
 *   <li>{@code docbuild.build.reaped}: in-progress attempts failed by the reaper</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code docbuild.queue.depth}: dequeueable entries at the last idle poll</li>
 *   <li>{@code docbuild.build.duration}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter syncRuns;
  private final Counter syncFailures;
  private final Counter enqueued;
  private final Counter blacklistSkipped;
  private final Counter buildSuccess;
  private final Counter buildFailure;
  private final Counter buildTimeout;
  private final Counter attemptsExhausted;
  private final Counter attemptsReaped;
  private final Gauge queueDepthGauge;
  private final Timer buildDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "docbuild"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "docbuild");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "staging.docbuild"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.syncRuns = Counter.builder(namePrefix + ".sync.runs")
        .description("Completed registry synchronizations")
        .register(registry);
    this.syncFailures = Counter.builder(namePrefix + ".sync.failures")
        .description("Registry synchronizations that aborted")
        .register(registry);
    this.enqueued = Counter.builder(namePrefix + ".queue.enqueued")
        .description("Queue entries created")
        .register(registry);
    this.blacklistSkipped = Counter.builder(namePrefix + ".queue.blacklist.skipped")
        .description("Releases not queued because the package is blacklisted")
        .register(registry);
    this.buildSuccess = Counter.builder(namePrefix + ".build.success")
        .description("Build attempts that produced documentation")
        .register(registry);
    this.buildFailure = Counter.builder(namePrefix + ".build.failure")
        .description("Build attempts that failed")
        .register(registry);
    this.buildTimeout = Counter.builder(namePrefix + ".build.timeout")
        .description("Build attempts killed at the time limit")
        .register(registry);
    this.attemptsExhausted = Counter.builder(namePrefix + ".queue.exhausted")
        .description("Queue entries that reached the attempt ceiling")
        .register(registry);
    this.attemptsReaped = Counter.builder(namePrefix + ".build.reaped")
        .description("Abandoned in-progress attempts marked failed")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.buildDuration = Timer.builder(namePrefix + ".build.duration")
        .description("Wall-clock time of a build attempt")
        .register(registry);
  }

  @Override
  public void incrementSyncRuns() {
    if (closed) return;
    syncRuns.increment();
  }

  @Override
  public void incrementSyncFailures() {
    if (closed) return;
    syncFailures.increment();
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementBlacklistSkipped() {
    if (closed) return;
    blacklistSkipped.increment();
  }

  @Override
  public void incrementBuildSuccess() {
    if (closed) return;
    buildSuccess.increment();
  }

  @Override
  public void incrementBuildFailure() {
    if (closed) return;
    buildFailure.increment();
  }

  @Override
  public void incrementAttemptsExhausted() {
    if (closed) return;
    attemptsExhausted.increment();
  }

  @Override
  public void incrementBuildTimeout() {
    if (closed) return;
    buildTimeout.increment();
  }

  @Override
  public void incrementAttemptsReaped() {
    if (closed) return;
    attemptsReaped.increment();
  }

  @Override
  public void recordQueueDepth(int pending) {
    if (closed) return;
    queueDepth.set(pending);
  }

  @Override
  public void recordBuildDurationMs(long durationMs) {
    if (closed) return;
    buildDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(syncRuns, syncFailures, enqueued, blacklistSkipped,
        buildSuccess, buildFailure, buildTimeout, attemptsExhausted, attemptsReaped,
        queueDepthGauge, buildDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
