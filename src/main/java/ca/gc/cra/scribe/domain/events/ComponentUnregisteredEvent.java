package ca.gc.cra.scribe.domain.events;

import ca.gc.cra.scribe.domain.component.ComponentType;
import java.util.Objects;

/**
 * Published after a component has been removed from the registry.
 *
 * @param componentId registry id; never {@code null}
 * @param componentType component role; never {@code null}
 * @param componentName display name; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#SYSTEM}
 * @since 0.1.0
 */
public record ComponentUnregisteredEvent(
    String componentId, ComponentType componentType, String componentName, EventMetadata metadata)
    implements UiEvent {

  public ComponentUnregisteredEvent {
    componentId = Objects.requireNonNull(componentId, "componentId");
    componentType = Objects.requireNonNull(componentType, "componentType");
    componentName = Objects.requireNonNull(componentName, "componentName");
    metadata = EventMetadata.forCategory(metadata, EventCategory.SYSTEM);
  }

  public ComponentUnregisteredEvent(String componentId, ComponentType componentType, String componentName) {
    this(componentId, componentType, componentName, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.COMPONENT_UNREGISTERED;
  }

  @Override
  public ComponentUnregisteredEvent withMetadata(EventMetadata metadata) {
    return new ComponentUnregisteredEvent(
        componentId, componentType, componentName, Objects.requireNonNull(metadata, "metadata"));
  }
}
