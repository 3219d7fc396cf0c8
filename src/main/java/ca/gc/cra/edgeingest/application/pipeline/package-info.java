/**
 * <strong>Purpose:</strong> The ingest loop, the event router and periodic metrics summaries.
 * <p><strong>Pipeline role:</strong> Application layer orchestrating sources, parser, sinks and checkpoint.
 * <p><strong>Concurrency:</strong> Single-threaded; the loop thread owns the checkpoint state.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.application.pipeline;
