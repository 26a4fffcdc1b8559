/**
 * One store per table group. Stores never commit; callers own the transaction.
 */
package docbuild.jdbc.store;
