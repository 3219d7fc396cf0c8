/**
 * Newline-delimited JSON sinks for events, dead letters and metrics summaries.
 */
package ca.gc.cra.edgeingest.infrastructure.sink;
