/**
 * Configuration loading and composition root wiring for the SCRIBE core services.
 * <p><strong>Role:</strong> Application bootstrap layer.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.scribe.config;
