/**
 * Micrometer bridge for {@link eventqueue.spi.MetricsExporter}.
 */
package eventqueue.micrometer;
