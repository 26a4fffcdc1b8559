/**
 * Micrometer bridge for docbuild metrics.
 *
 * @see docbuild.micrometer.MicrometerMetricsExporter
 */
package docbuild.micrometer;
