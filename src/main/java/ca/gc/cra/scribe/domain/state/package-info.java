/**
 * Value helpers for the UI state store: the accepted JSON value subset, nested key paths and history records.
 */
package ca.gc.cra.scribe.domain.state;
