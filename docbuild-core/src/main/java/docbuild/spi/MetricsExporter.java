package docbuild.spi;

/**
 * Observability hook for exporting sync, queue and build counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of completed synchronization runs.
     */
    void incrementSyncRuns();

    /**
     * Increments the count of synchronization runs aborted by an error.
     */
    void incrementSyncFailures();

    /**
     * Increments the count of queue entries created (by sync, rebuilds or manual enqueue).
     */
    void incrementEnqueued();

    /**
     * Increments the count of candidates dropped because the package is blacklisted.
     */
    void incrementBlacklistSkipped();

    /**
     * Increments the count of build attempts that ended in success.
     */
    void incrementBuildSuccess();

    /**
     * Increments the count of build attempts that ended in failure.
     */
    void incrementBuildFailure();

    /**
     * Increments the count of queue entries that reached the attempt ceiling.
     */
    void incrementAttemptsExhausted();

    /**
     * Increments the count of build attempts killed by the wall-clock timeout.
     */
    default void incrementBuildTimeout() {
    }

    /**
     * Increments the count of in-progress attempts failed by the stale-attempt reaper.
     */
    default void incrementAttemptsReaped() {
    }

    /**
     * Records the number of dequeueable entries.
     *
     * @param pending entries below the attempt ceiling
     */
    void recordQueueDepth(int pending);

    /**
     * Records the wall-clock duration of one build attempt.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordBuildDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSyncRuns() {
        }

        @Override
        public void incrementSyncFailures() {
        }

        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementBlacklistSkipped() {
        }

        @Override
        public void incrementBuildSuccess() {
        }

        @Override
        public void incrementBuildFailure() {
        }

        @Override
        public void incrementAttemptsExhausted() {
        }

        @Override
        public void recordQueueDepth(int pending) {
        }
    }
}
