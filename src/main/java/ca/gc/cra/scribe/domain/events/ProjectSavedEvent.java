package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published after the open project has been saved.
 *
 * @param projectId identifier of the affected project; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#PROJECT}
 * @since 0.1.0
 */
public record ProjectSavedEvent(String projectId, EventMetadata metadata) implements UiEvent {

  public ProjectSavedEvent {
    projectId = Objects.requireNonNull(projectId, "projectId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.PROJECT);
  }

  public ProjectSavedEvent(String projectId) {
    this(projectId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.PROJECT_SAVED;
  }

  @Override
  public ProjectSavedEvent withMetadata(EventMetadata metadata) {
    return new ProjectSavedEvent(projectId, Objects.requireNonNull(metadata, "metadata"));
  }
}
