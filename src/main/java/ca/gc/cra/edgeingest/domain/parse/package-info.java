/**
 * <strong>Purpose:</strong> FortiGate line grammar: syslog envelope, key/value body and timestamp resolution.
 * <p><strong>Pipeline role:</strong> Pure transformation between the file sources and the event router.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.domain.parse;
