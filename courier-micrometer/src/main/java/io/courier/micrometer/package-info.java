/**
 * Micrometer bridge for {@link io.courier.spi.MetricsExporter}.
 *
 * @see io.courier.micrometer.MicrometerMetricsExporter
 */
package io.courier.micrometer;
