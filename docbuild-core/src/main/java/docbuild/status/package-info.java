/**
 * Release status aggregation.
 */
package docbuild.status;
