/**
 * JSON file storage for persistent UI state.
 */
package ca.gc.cra.scribe.infrastructure.persistence;
