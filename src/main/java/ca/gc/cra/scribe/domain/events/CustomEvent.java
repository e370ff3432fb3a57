package ca.gc.cra.scribe.domain.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Application-defined event for plugins and features that have no dedicated variant.
 *
 * <p>Unlike the built-in variants, the priority is chosen by the producer.</p>
 *
 * @param name event name, conventionally dotted such as {@code outline.reordered}; never {@code null}
 * @param attributes payload attributes; copied, values may be {@code null}
 * @param metadata event metadata; category is always {@link EventCategory#CUSTOM}
 * @since 0.1.0
 */
public record CustomEvent(String name, Map<String, Object> attributes, EventMetadata metadata)
    implements UiEvent {

  public CustomEvent {
    name = Objects.requireNonNull(name, "name");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    metadata = EventMetadata.forCategory(metadata, EventCategory.CUSTOM);
  }

  public CustomEvent(String name, Map<String, Object> attributes) {
    this(name, attributes, (EventMetadata) null);
  }

  public CustomEvent(String name, Map<String, Object> attributes, EventPriority priority) {
    this(name, attributes, EventMetadata.of(EventCategory.CUSTOM, priority));
  }

  @Override
  public EventKind kind() {
    return EventKind.CUSTOM;
  }

  @Override
  public CustomEvent withMetadata(EventMetadata metadata) {
    return new CustomEvent(name, attributes, Objects.requireNonNull(metadata, "metadata"));
  }
}
