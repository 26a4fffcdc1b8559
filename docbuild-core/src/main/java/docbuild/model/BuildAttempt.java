package docbuild.model;

import java.time.Instant;

/**
 * One execution record of a documentation build. Attempts are append-only: a
 * retry is a new attempt, never a mutation of an old one.
 */
public record BuildAttempt(
    long id,
    long releaseId,
    String toolchainVersion,
    String builderVersion,
    BuildStatus status,
    Instant startedAt,
    Instant finishedAt,
    String output,
    String buildServer
) {}
