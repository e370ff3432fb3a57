/**
 * Validation utilities for configuration values and constructor arguments.
 */
package ca.gc.cra.scribe.validation;
