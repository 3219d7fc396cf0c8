/**
 * Configuration loading and composition root wiring for the edge ingest agent.
 * <p><strong>Role:</strong> Bootstrap layer translating defaults, YAML and CLI arguments into a validated
 * {@link ca.gc.cra.edgeingest.config.IngestConfig} and the adapters it selects.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths and file-name tokens pass through {@code ca.gc.cra.edgeingest.validation}
 * before use.</p>
 */
package ca.gc.cra.edgeingest.config;
