package docbuild.model;

import java.time.Instant;

/**
 * Aggregated outcome across every build attempt of a release.
 *
 * @param releaseId     the release
 * @param status        aggregated status
 * @param lastBuildTime latest finish time among concluded attempts, or {@code null}
 */
public record ReleaseStatus(long releaseId, BuildStatus status, Instant lastBuildTime) {}
