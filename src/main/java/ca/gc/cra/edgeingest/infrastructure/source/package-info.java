/**
 * File-system adapters reading rotated and active FortiGate log files line by line.
 *
 * <p>Both readers split on raw bytes so offsets stay exact regardless of the text encoding.</p>
 */
package ca.gc.cra.edgeingest.infrastructure.source;
