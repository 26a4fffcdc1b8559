/**
 * Database dialects: H2 (candidate claim), MySQL ({@code UPDATE...ORDER BY...LIMIT})
 * and PostgreSQL ({@code FOR UPDATE SKIP LOCKED}).
 */
package docbuild.jdbc.dialect;
