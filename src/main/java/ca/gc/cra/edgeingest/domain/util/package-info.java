/**
 * <strong>Purpose:</strong> Byte and digest helpers shared by parsing and source adapters.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.domain.util;
