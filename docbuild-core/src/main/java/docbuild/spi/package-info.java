/**
 * Service Provider Interfaces (SPI) for plugging docbuild into a database and
 * a metrics backend.
 *
 * <p>Every store method takes an explicit {@link java.sql.Connection} so the
 * caller decides which writes share a transaction.
 *
 * @see docbuild.spi.ConnectionProvider
 * @see docbuild.spi.QueueStore
 * @see docbuild.spi.DocBuildStores
 * @see docbuild.spi.MetricsExporter
 */
package docbuild.spi;
