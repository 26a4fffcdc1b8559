/**
 * JDBC implementations of the docbuild store SPIs.
 *
 * <p>{@link docbuild.jdbc.JdbcStores} assembles a {@link docbuild.spi.DocBuildStores}
 * for a {@link docbuild.jdbc.spi.Dialect}. Schema DDL for each supported
 * database ships under {@code schema/}.
 *
 * @see docbuild.jdbc.JdbcStores
 * @see docbuild.jdbc.dialect.Dialects
 */
package docbuild.jdbc;
