/**
 * <strong>Purpose:</strong> Ports between the ingest loop and the filesystem, sinks, clock and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> All ports are driven from the single ingest loop thread unless documented
 * otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.application.port;
