/**
 * Build workers that drain the queue into the sandbox executor.
 */
package docbuild.worker;
