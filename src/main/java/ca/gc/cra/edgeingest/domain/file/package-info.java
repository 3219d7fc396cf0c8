/**
 * <strong>Purpose:</strong> File identity and source-position value types.
 * <p><strong>Pipeline role:</strong> Produced by the catalog and tailer adapters, carried through parsing
 * and routing so every persisted record can be traced back to a byte range of a physical file.
 * <p><strong>Concurrency:</strong> Immutable records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.domain.file;
