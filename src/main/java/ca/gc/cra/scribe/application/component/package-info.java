/**
 * Component registry: registration, dependency injection, lifecycle management and class-path discovery.
 * <p><strong>Concurrency:</strong> Confined to the UI thread.</p>
 * <p><strong>Metrics:</strong> {@code registry.components.registered}, {@code registry.components.failed}.</p>
 */
package ca.gc.cra.scribe.application.component;
