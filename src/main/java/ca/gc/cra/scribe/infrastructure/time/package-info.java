/**
 * Clock adapters.
 */
package ca.gc.cra.scribe.infrastructure.time;
