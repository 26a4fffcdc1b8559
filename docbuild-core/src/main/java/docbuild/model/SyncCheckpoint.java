package docbuild.model;

import java.time.Instant;

/**
 * Durable pointer recording how far registry synchronization has progressed.
 *
 * @param name      checkpoint row name
 * @param reference last-seen index reference
 * @param version   optimistic-concurrency counter, incremented on every advance
 * @param updatedAt time of the last advance
 */
public record SyncCheckpoint(String name, String reference, long version, Instant updatedAt) {}
