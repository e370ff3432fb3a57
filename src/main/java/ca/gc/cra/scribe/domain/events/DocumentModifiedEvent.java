package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when a document's in-memory content diverges from storage.
 *
 * @param documentId identifier of the affected document; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#DOCUMENT}
 * @since 0.1.0
 */
public record DocumentModifiedEvent(String documentId, EventMetadata metadata) implements UiEvent {

  public DocumentModifiedEvent {
    documentId = Objects.requireNonNull(documentId, "documentId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.DOCUMENT);
  }

  public DocumentModifiedEvent(String documentId) {
    this(documentId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.DOCUMENT_MODIFIED;
  }

  @Override
  public DocumentModifiedEvent withMetadata(EventMetadata metadata) {
    return new DocumentModifiedEvent(documentId, Objects.requireNonNull(metadata, "metadata"));
  }
}
