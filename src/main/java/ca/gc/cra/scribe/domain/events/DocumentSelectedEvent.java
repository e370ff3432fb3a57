package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when the user selects a document in the project tree.
 *
 * @param documentId identifier of the affected document; never {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#DOCUMENT}
 * @since 0.1.0
 */
public record DocumentSelectedEvent(String documentId, EventMetadata metadata) implements UiEvent {

  public DocumentSelectedEvent {
    documentId = Objects.requireNonNull(documentId, "documentId");
    metadata = EventMetadata.forCategory(metadata, EventCategory.DOCUMENT);
  }

  public DocumentSelectedEvent(String documentId) {
    this(documentId, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.DOCUMENT_SELECTED;
  }

  @Override
  public DocumentSelectedEvent withMetadata(EventMetadata metadata) {
    return new DocumentSelectedEvent(documentId, Objects.requireNonNull(metadata, "metadata"));
  }
}
