/**
 * Ports the core services depend on: clock, metrics, state persistence and error reporting.
 * <p><strong>Role:</strong> Application boundary implemented by {@code ca.gc.cra.scribe.infrastructure} adapters.</p>
 */
package ca.gc.cra.scribe.application.port;
