/**
 * Administrative and query surfaces.
 */
package docbuild.admin;
