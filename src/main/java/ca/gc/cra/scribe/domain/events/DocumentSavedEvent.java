package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published after a document has been written to storage.
 *
 * @param documentId identifier of the affected document; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#DOCUMENT}
 * @since 0.1.0
 */
public record DocumentSavedEvent(String documentId, EventMetadata metadata) implements UiEvent {

  public DocumentSavedEvent {
    documentId = Objects.requireNonNull(documentId, "documentId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.DOCUMENT);
  }

  public DocumentSavedEvent(String documentId) {
    this(documentId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.DOCUMENT_SAVED;
  }

  @Override
  public DocumentSavedEvent withMetadata(EventMetadata metadata) {
    return new DocumentSavedEvent(documentId, Objects.requireNonNull(metadata, "metadata"));
  }
}
