/**
 * Logging helpers: runtime level control and bounded rendering of logged values.
 */
package ca.gc.cra.scribe.logging;
