package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published after a document's content has been loaded into an editor.
 *
 * @param documentId identifier of the affected document; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#DOCUMENT}
 * @since 0.1.0
 */
public record DocumentLoadedEvent(String documentId, EventMetadata metadata) implements UiEvent {

  public DocumentLoadedEvent {
    documentId = Objects.requireNonNull(documentId, "documentId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.DOCUMENT);
  }

  public DocumentLoadedEvent(String documentId) {
    this(documentId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.DOCUMENT_LOADED;
  }

  @Override
  public DocumentLoadedEvent withMetadata(EventMetadata metadata) {
    return new DocumentLoadedEvent(documentId, Objects.requireNonNull(metadata, "metadata"));
  }
}
