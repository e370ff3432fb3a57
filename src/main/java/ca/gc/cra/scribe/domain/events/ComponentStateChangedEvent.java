package ca.gc.cra.scribe.domain.events;

import ca.gc.cra.scribe.domain.component.ComponentState;
import java.util.Objects;

/**
 * Published on every lifecycle transition of a registered component.
 *
 * @param componentId registry id; never {@code null}
 * @param previousState state before the transition; never {@code null}
 * @param newState state after the transition; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#SYSTEM}
 * @since 0.1.0
 */
public record ComponentStateChangedEvent(
    String componentId, ComponentState previousState, ComponentState newState, EventMetadata metadata)
    implements UiEvent {

  public ComponentStateChangedEvent {
    componentId = Objects.requireNonNull(componentId, "componentId");
    previousState = Objects.requireNonNull(previousState, "previousState");
    newState = Objects.requireNonNull(newState, "newState");
    metadata = EventMetadata.forCategory(metadata, EventCategory.SYSTEM);
  }

  public ComponentStateChangedEvent(
      String componentId, ComponentState previousState, ComponentState newState) {
    this(componentId, previousState, newState, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.COMPONENT_STATE_CHANGED;
  }

  @Override
  public ComponentStateChangedEvent withMetadata(EventMetadata metadata) {
    return new ComponentStateChangedEvent(
        componentId, previousState, newState, Objects.requireNonNull(metadata, "metadata"));
  }
}
