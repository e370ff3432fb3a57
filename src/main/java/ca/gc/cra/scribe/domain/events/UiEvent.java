package ca.gc.cra.scribe.domain.events;

import java.time.Instant;

/**
 * Immutable event published through the SCRIBE event bus.
 *
 * <p><strong>What:</strong> Closed family of event records describing document, project, UI, error, and
 * component lifecycle activity.</p>
 * <p><strong>Why:</strong> A sealed hierarchy lets dispatch code switch exhaustively over {@link #kind()}
 * instead of probing payload shapes.</p>
 * <p><strong>Thread-safety:</strong> All variants are records with immutable payloads.</p>
 *
 * @since 0.1.0
 */
public sealed interface UiEvent
    permits DocumentSelectedEvent,
        DocumentLoadedEvent,
        DocumentSavedEvent,
        DocumentModifiedEvent,
        DocumentCreatedEvent,
        DocumentDeletedEvent,
        ProjectLoadedEvent,
        ProjectSavedEvent,
        ProjectClosedEvent,
        ProjectCreatedEvent,
        UiThemeChangedEvent,
        UiStateChangedEvent,
        ErrorOccurredEvent,
        ComponentRegisteredEvent,
        ComponentUnregisteredEvent,
        ComponentStateChangedEvent,
        ComponentFailedEvent,
        CustomEvent {

  /**
   * Returns the metadata block.
   *
   * @return metadata; never {@code null}
   */
  EventMetadata metadata();

  /**
   * Returns the variant tag.
   *
   * @return kind of this event
   */
  EventKind kind();

  /**
   * Returns a copy of this event carrying {@code metadata}. Variants with a fixed category or priority
   * re-apply it, so callers cannot use this method to reclassify an event.
   *
   * @param metadata replacement metadata; never {@code null}
   * @return copy of this event
   */
  UiEvent withMetadata(EventMetadata metadata);

  default EventCategory category() {
    return metadata().category();
  }

  default EventPriority priority() {
    return metadata().priority();
  }

  default String source() {
    return metadata().source();
  }

  default Instant timestamp() {
    return metadata().timestamp();
  }
}
