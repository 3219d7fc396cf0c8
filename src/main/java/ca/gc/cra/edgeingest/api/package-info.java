/**
 * CLI entry points for running the ingest loop and its operator tools.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, configure logging and telemetry, and invoke use
 * cases.</p>
 * <p><strong>Concurrency:</strong> The ingest loop runs on the CLI thread; a shutdown hook interrupts it.</p>
 */
package ca.gc.cra.edgeingest.api;
