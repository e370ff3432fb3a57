package ca.gc.cra.scribe.domain.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata block carried by every {@link UiEvent}.
 *
 * <p>The {@code source} is the empty string until either the producer or the event bus fills it in.
 * Instances are immutable; the {@code with*} methods return copies.</p>
 *
 * @param timestamp creation instant; never {@code null}
 * @param source producer identifier such as {@code DocumentPanel.onClick}; never {@code null}, may be empty
 * @param priority event priority; defaults to {@link EventPriority#NORMAL}
 * @param category functional domain; never {@code null}
 * @since 0.1.0
 */
public record EventMetadata(
    Instant timestamp, String source, EventPriority priority, EventCategory category) {

  public EventMetadata {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    source = source == null ? "" : source;
    priority = priority == null ? EventPriority.NORMAL : priority;
    category = Objects.requireNonNull(category, "category");
  }

  /**
   * Creates metadata stamped with the current time, no source, and normal priority.
   *
   * @param category functional domain of the event
   * @return new metadata
   */
  public static EventMetadata of(EventCategory category) {
    return new EventMetadata(Instant.now(), "", EventPriority.NORMAL, category);
  }

  /**
   * Creates metadata stamped with the current time and no source.
   *
   * @param category functional domain of the event
   * @param priority event priority
   * @return new metadata
   */
  public static EventMetadata of(EventCategory category, EventPriority priority) {
    return new EventMetadata(Instant.now(), "", priority, category);
  }

  public boolean hasSource() {
    return !source.isEmpty();
  }

  public EventMetadata withSource(String newSource) {
    return new EventMetadata(timestamp, newSource, priority, category);
  }

  public EventMetadata withPriority(EventPriority newPriority) {
    return new EventMetadata(timestamp, source, newPriority, category);
  }

  public EventMetadata withCategory(EventCategory newCategory) {
    return new EventMetadata(timestamp, source, priority, newCategory);
  }

  /**
   * Returns metadata for a variant whose category is fixed, creating fresh metadata when none was supplied.
   *
   * @param metadata caller-supplied metadata; may be {@code null}
   * @param category category the variant always carries
   * @return metadata with {@code category} applied
   */
  static EventMetadata forCategory(EventMetadata metadata, EventCategory category) {
    if (metadata == null) {
      return of(category);
    }
    return metadata.category() == category ? metadata : metadata.withCategory(category);
  }
}
