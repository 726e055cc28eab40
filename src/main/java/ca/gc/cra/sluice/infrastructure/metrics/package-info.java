/**
 * OpenTelemetry implementation of the metrics port.
 * <p>Publishes under the {@code transfer.*} namespace; only counts, durations and byte totals are exported,
 * never transferred content.</p>
 */
package ca.gc.cra.sluice.infrastructure.metrics;
