package ca.gc.cra.scribe.domain.events;

/**
 * Functional domain an event belongs to. Filters and history queries select on this value.
 *
 * @since 0.1.0
 */
public enum EventCategory {
  DOCUMENT,
  PROJECT,
  UI,
  ERROR,
  SYSTEM,
  CUSTOM
}
