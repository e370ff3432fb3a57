/**
 * Metrics adapter that bridges the SCRIBE metrics port to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps.</p>
 */
package ca.gc.cra.scribe.infrastructure.metrics;
