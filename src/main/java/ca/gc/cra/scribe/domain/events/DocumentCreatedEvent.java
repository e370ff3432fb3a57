package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when a new document is added to the open project.
 *
 * @param documentId identifier of the affected document; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#DOCUMENT}
 * @since 0.1.0
 */
public record DocumentCreatedEvent(String documentId, EventMetadata metadata) implements UiEvent {

  public DocumentCreatedEvent {
    documentId = Objects.requireNonNull(documentId, "documentId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.DOCUMENT);
  }

  public DocumentCreatedEvent(String documentId) {
    this(documentId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.DOCUMENT_CREATED;
  }

  @Override
  public DocumentCreatedEvent withMetadata(EventMetadata metadata) {
    return new DocumentCreatedEvent(documentId, Objects.requireNonNull(metadata, "metadata"));
  }
}
