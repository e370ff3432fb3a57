package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when a document is removed from the open project.
 *
 * @param documentId identifier of the affected document; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#DOCUMENT}
 * @since 0.1.0
 */
public record DocumentDeletedEvent(String documentId, EventMetadata metadata) implements UiEvent {

  public DocumentDeletedEvent {
    documentId = Objects.requireNonNull(documentId, "documentId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.DOCUMENT);
  }

  public DocumentDeletedEvent(String documentId) {
    this(documentId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.DOCUMENT_DELETED;
  }

  @Override
  public DocumentDeletedEvent withMetadata(EventMetadata metadata) {
    return new DocumentDeletedEvent(documentId, Objects.requireNonNull(metadata, "metadata"));
  }
}
