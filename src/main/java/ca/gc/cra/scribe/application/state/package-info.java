/**
 * Observable key/value UI state with nested paths, undo/redo and file persistence of selected keys.
 * <p><strong>Metrics:</strong> {@code state.changes}, {@code state.persist.failures}.</p>
 */
package ca.gc.cra.scribe.application.state;
