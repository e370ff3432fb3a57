package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published after a project has been opened.
 *
 * @param projectId identifier of the affected project; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#PROJECT}
 * @since 0.1.0
 */
public record ProjectLoadedEvent(String projectId, EventMetadata metadata) implements UiEvent {

  public ProjectLoadedEvent {
    projectId = Objects.requireNonNull(projectId, "projectId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.PROJECT);
  }

  public ProjectLoadedEvent(String projectId) {
    this(projectId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.PROJECT_LOADED;
  }

  @Override
  public ProjectLoadedEvent withMetadata(EventMetadata metadata) {
    return new ProjectLoadedEvent(projectId, Objects.requireNonNull(metadata, "metadata"));
  }
}
