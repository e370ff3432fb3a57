package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when the open project is closed. Carries no payload.
 *
 * @param metadata event metadata; category is always {@link EventCategory#PROJECT}
 * @since 0.1.0
 */
public record ProjectClosedEvent(EventMetadata metadata) implements UiEvent {

  public ProjectClosedEvent {
    metadata = EventMetadata.forCategory(metadata, EventCategory.PROJECT);
  }

  public ProjectClosedEvent() {
    this(null);
  }

  @Override
  public EventKind kind() {
    return EventKind.PROJECT_CLOSED;
  }

  @Override
  public ProjectClosedEvent withMetadata(EventMetadata metadata) {
    return new ProjectClosedEvent(Objects.requireNonNull(metadata, "metadata"));
  }
}
