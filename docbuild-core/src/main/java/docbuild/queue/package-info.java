/**
 * The build queue: priority-ordered, retry-aware and pausable.
 */
package docbuild.queue;
