package ca.gc.cra.scribe.domain.events;

/**
 * Relative urgency attached to every {@link UiEvent}.
 *
 * @since 0.1.0
 */
public enum EventPriority {
  LOW,
  NORMAL,
  HIGH,
  CRITICAL
}
