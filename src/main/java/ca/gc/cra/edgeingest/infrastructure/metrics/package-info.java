/**
 * OpenTelemetry implementation of the metrics port.
 *
 * <p>When the exporter is {@code none} the adapter records into a no-op meter, so callers never branch on
 * whether export is enabled.</p>
 */
package ca.gc.cra.edgeingest.infrastructure.metrics;
