package ca.gc.cra.scribe.domain.events;

import java.util.Objects;

/**
 * Published when an error should be surfaced to the user or to diagnostics.
 *
 * @param errorType short classification such as {@code StatePersistence}; never {@code null}
 * @param errorMessage human-readable description; never {@code null}
 * @param metadata event metadata; always {@link EventCategory#ERROR} with {@link EventPriority#HIGH}
 * @since 0.1.0
 */
public record ErrorOccurredEvent(String errorType, String errorMessage, EventMetadata metadata)
    implements UiEvent {

  public ErrorOccurredEvent {
    errorType = Objects.requireNonNull(errorType, "errorType");
    errorMessage = errorMessage == null ? "" : errorMessage;
    metadata = EventMetadata.forCategory(metadata, EventCategory.ERROR).withPriority(EventPriority.HIGH);
  }

  public ErrorOccurredEvent(String errorType, String errorMessage) {
    this(errorType, errorMessage, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.ERROR_OCCURRED;
  }

  @Override
  public ErrorOccurredEvent withMetadata(EventMetadata metadata) {
    return new ErrorOccurredEvent(errorType, errorMessage, Objects.requireNonNull(metadata, "metadata"));
  }
}
