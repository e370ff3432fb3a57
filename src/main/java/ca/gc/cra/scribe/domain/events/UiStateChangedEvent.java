package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published by the state manager after every effective change to a state key or nested path.
 *
 * <p>For nested changes {@code stateKey} is the dot-joined path. A {@code null} value means the key was
 * cleared. The value is a snapshot and must be treated as read-only.</p>
 *
 * @param stateKey changed key or dot-joined path; never {@code null}
 * @param stateValue new value; may be {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#UI}
 * @since 0.1.0
 */
public record UiStateChangedEvent(String stateKey, Object stateValue, EventMetadata metadata)
    implements UiEvent {

  public UiStateChangedEvent {
    stateKey = Objects.requireNonNull(stateKey, "stateKey");
    metadata = EventMetadata.forCategory(metadata, EventCategory.UI);
  }

  public UiStateChangedEvent(String stateKey, Object stateValue) {
    this(stateKey, stateValue, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.UI_STATE_CHANGED;
  }

  @Override
  public UiStateChangedEvent withMetadata(EventMetadata metadata) {
    return new UiStateChangedEvent(stateKey, stateValue, Objects.requireNonNull(metadata, "metadata"));
  }
}
