/**
 * <strong>Purpose:</strong> Typed firewall events, dead-letter records and parse outcomes.
 * <p><strong>Pipeline role:</strong> Output of the line parser, input of the event router and sinks.
 * <p><strong>Concurrency:</strong> Immutable records and enums.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.domain.event;
