/**
 * Synchronous publish/subscribe event bus with bounded history and legacy channel fan-out.
 * <p><strong>Concurrency:</strong> Confined to the UI thread.</p>
 * <p><strong>Metrics:</strong> {@code events.emitted}, {@code events.handler.failures}.</p>
 */
package ca.gc.cra.scribe.application.events;
