/**
 * <strong>Purpose:</strong> Jackson streaming helpers shared by the checkpoint store and CLI tools.
 * <p><strong>Concurrency:</strong> Instances are thread-safe once constructed.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.infrastructure.json;
