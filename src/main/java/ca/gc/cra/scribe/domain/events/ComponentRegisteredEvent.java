package ca.gc.cra.scribe.domain.events;

import ca.gc.cra.scribe.domain.component.ComponentType;
import java.util.Objects;

/**
 * Published after a component has been added to the registry.
 *
 * @param componentId registry id; never {@code null}
 * @param componentType component role; never {@code null}
 * @param componentName display name; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#SYSTEM}
 * @since 0.1.0
 */
public record ComponentRegisteredEvent(
    String componentId, ComponentType componentType, String componentName, EventMetadata metadata)
    implements UiEvent {

  public ComponentRegisteredEvent {
    componentId = Objects.requireNonNull(componentId, "componentId");
    componentType = Objects.requireNonNull(componentType, "componentType");
    componentName = Objects.requireNonNull(componentName, "componentName");
    metadata = EventMetadata.forCategory(metadata, EventCategory.SYSTEM);
  }

  public ComponentRegisteredEvent(String componentId, ComponentType componentType, String componentName) {
    this(componentId, componentType, componentName, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.COMPONENT_REGISTERED;
  }

  @Override
  public ComponentRegisteredEvent withMetadata(EventMetadata metadata) {
    return new ComponentRegisteredEvent(
        componentId, componentType, componentName, Objects.requireNonNull(metadata, "metadata"));
  }
}
