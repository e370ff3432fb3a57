/**
 * Typed UI events, their metadata and the filters used to select them.
 * <p><strong>Role:</strong> Domain layer; immutable records with no framework dependencies.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 */
package ca.gc.cra.scribe.domain.events;
