/**
 * Continuous rebuilds of already documented releases.
 */
package docbuild.rebuild;
