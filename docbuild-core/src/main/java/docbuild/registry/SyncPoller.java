package docbuild.registry;

import docbuild.spi.MetricsExporter;
import docbuild.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives {@link IndexSynchronizer} from two sources: push notifications
 * ({@link #trigger()}) and a fixed-delay fallback poll.
 *
 * <p>All runs execute on one scheduler thread, so runs of the same poller never
 * overlap. Triggers that arrive while a run is already pending are coalesced
 * into it. A notification carries no data; the synchronizer always re-reads
 * the index.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see SyncPoller.Builder
 */
public final class SyncPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SyncPoller.class.getName());

    private final IndexSynchronizer synchronizer;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final AtomicBoolean triggerPending = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private SyncPoller(Builder builder) {
        this.synchronizer = Objects.requireNonNull(builder.synchronizer, "synchronizer");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the fallback polling loop. The first run happens immediately.
     * Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("SyncPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("docbuild-sync-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Requests a sync as soon as possible, typically on a registry push notification.
     *
     * @return {@code false} if the poller is not running; {@code true} if a run
     *         was scheduled or one was already pending
     */
    public boolean trigger() {
        ScheduledExecutorService current = scheduler;
        if (closed || current == null) {
            return false;
        }
        if (!triggerPending.compareAndSet(false, true)) {
            return true;
        }
        try {
            current.execute(() -> {
                triggerPending.set(false);
                poll();
            });
            return true;
        } catch (RejectedExecutionException e) {
            triggerPending.set(false);
            logger.log(Level.FINE, "Sync trigger rejected; poller is shutting down", e);
            return false;
        }
    }

    /**
     * Executes a single sync. Called automatically by the scheduler, but may also be invoked directly for testing.
     *
     * @return the result, or {@code null} if the run failed
     */
    public SyncResult poll() {
        if (closed) {
            return null;
        }
        try {
            SyncResult result = synchronizer.synchronize();
            metrics.incrementSyncRuns();
            return result;
        } catch (RegistryIndexException e) {
            metrics.incrementSyncFailures();
            logger.log(Level.WARNING, "Registry index unavailable; sync will be retried", e);
        } catch (Throwable t) {
            metrics.incrementSyncFailures();
            logger.log(Level.SEVERE, "Sync cycle failed", t);
        }
        return null;
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
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

    /**
     * Builder for {@link SyncPoller}.
     */
    public static final class Builder {
        private IndexSynchronizer synchronizer;
        private long intervalMs = 60_000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the synchronizer to run.
         *
         * <p><b>Required.</b>
         *
         * @param synchronizer the synchronizer
         * @return this builder
         */
        public Builder synchronizer(IndexSynchronizer synchronizer) {
            this.synchronizer = synchronizer;
            return this;
        }

        /**
         * Sets the delay between fallback polls in milliseconds.
         *
         * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the metrics exporter for sync run counters.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the poller. Call {@link SyncPoller#start()} to begin the polling schedule.
         *
         * @return a new {@link SyncPoller} instance
         * @throws NullPointerException     if {@code synchronizer} is null
         * @throws IllegalArgumentException if {@code intervalMs <= 0}
         */
        public SyncPoller build() {
            return new SyncPoller(this);
        }
    }
}
