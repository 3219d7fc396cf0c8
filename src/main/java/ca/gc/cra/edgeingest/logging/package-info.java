/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and make raw log lines printable.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for the ingest loop and CLI tools.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.logging;
