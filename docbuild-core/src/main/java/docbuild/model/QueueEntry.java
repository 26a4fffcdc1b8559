package docbuild.model;

import java.time.Instant;

/**
 * A pending request to build one package version, as stored in the queue.
 *
 * @param id          insertion-ordered identifier
 * @param name        package name as enqueued
 * @param version     package version
 * @param priority    lower is more urgent
 * @param registry    registry of origin, {@code null} for the default registry
 * @param attempts    failed attempts so far
 * @param lastAttempt time of the last recorded attempt, or {@code null}
 * @param queuedAt    time the entry was created
 */
public record QueueEntry(
    long id,
    String name,
    String version,
    int priority,
    String registry,
    int attempts,
    Instant lastAttempt,
    Instant queuedAt
) {

  /**
   * Returns {@code true} when this entry has used up its retry budget and
   * will no longer be handed out.
   */
  public boolean exhausted(int maxAttempts) {
    return attempts >= maxAttempts;
  }
}
