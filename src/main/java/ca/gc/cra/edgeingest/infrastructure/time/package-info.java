/**
 * Clock adapters.
 */
package ca.gc.cra.edgeingest.infrastructure.time;
