/**
 * Registry synchronization: reading index changes, applying them to the
 * release tables and the build queue, and keeping the checkpoint.
 *
 * <p>{@link docbuild.registry.IndexSynchronizer} performs one run;
 * {@link docbuild.registry.SyncPoller} schedules runs on push notifications
 * and on a fallback interval.
 */
package docbuild.registry;
