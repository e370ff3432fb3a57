/**
 * Error reporters that log failures and republish them on the event bus.
 */
package ca.gc.cra.scribe.infrastructure.errors;
