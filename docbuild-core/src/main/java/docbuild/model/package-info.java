/**
 * Domain records: packages, releases, build attempts, queue entries and the
 * configuration rows that steer scheduling.
 *
 * @see docbuild.model.QueueEntry
 * @see docbuild.model.BuildAttempt
 * @see docbuild.model.ReleaseStatus
 */
package docbuild.model;
