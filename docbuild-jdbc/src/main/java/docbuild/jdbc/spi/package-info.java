/**
 * Extension point for additional databases, registered via
 * {@code META-INF/services/docbuild.jdbc.spi.Dialect}.
 */
package docbuild.jdbc.spi;
