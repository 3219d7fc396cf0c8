/**
 * File-backed checkpoint persistence with atomic replace semantics.
 */
package ca.gc.cra.edgeingest.infrastructure.checkpoint;
