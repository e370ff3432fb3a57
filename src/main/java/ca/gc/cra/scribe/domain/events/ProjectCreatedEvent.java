package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when a new project is created.
 *
 * @param projectId identifier of the affected project; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#PROJECT}
 * @since 0.1.0
 */
public record ProjectCreatedEvent(String projectId, EventMetadata metadata) implements UiEvent {

  public ProjectCreatedEvent {
    projectId = Objects.requireNonNull(projectId, "projectId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.PROJECT);
  }

  public ProjectCreatedEvent(String projectId) {
    this(projectId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.PROJECT_CREATED;
  }

  @Override
  public ProjectCreatedEvent withMetadata(EventMetadata metadata) {
    return new ProjectCreatedEvent(projectId, Objects.requireNonNull(metadata, "metadata"));
  }
}
