package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when a lifecycle operation on a component fails and the component enters the error state.
 *
 * @param componentId registry id; never {@code null}
 * @param operation failed operation, for example {@code createInstance} or {@code dispose}; never {@code null}
 * @param errorMessage failure description; never {@code null}
 * @param metadata event metadata; always {@link EventCategory#ERROR} with {@link EventPriority#HIGH}
 * @since 0.1.0
 */
public record ComponentFailedEvent(
    String componentId, String operation, String errorMessage, EventMetadata metadata)
    implements UiEvent {

  public ComponentFailedEvent {
    componentId = Objects.requireNonNull(componentId, "componentId");
    operation = Objects.requireNonNull(operation, "operation");
    errorMessage = errorMessage == null ? "" : errorMessage;
    metadata = EventMetadata.forCategory(metadata, EventCategory.ERROR).withPriority(EventPriority.HIGH);
  }

  public ComponentFailedEvent(String componentId, String operation, String errorMessage) {
    this(componentId, operation, errorMessage, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.COMPONENT_FAILED;
  }

  @Override
  public ComponentFailedEvent withMetadata(EventMetadata metadata) {
    return new ComponentFailedEvent(
        componentId, operation, errorMessage, Objects.requireNonNull(metadata, "metadata"));
  }
}
