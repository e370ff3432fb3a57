package ca.gc.cra.scribe.domain.events;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * Conjunctive predicate over event category, priority and concrete type.
 *
 * <p>An empty dimension accepts any value. A non-empty dimension must contain the event's attribute,
 * and every non-empty dimension must accept for {@link #matches(UiEvent)} to pass. Type matching is by
 * exact runtime class.</p>
 *
 * @param categories accepted categories; empty means any
 * @param priorities accepted priorities; empty means any
 * @param eventTypes accepted concrete event classes; empty means any
 * @since 0.1.0
 */
public record EventFilter(
    Set<EventCategory> categories,
    Set<EventPriority> priorities,
    Set<Class<? extends UiEvent>> eventTypes) {

  /** Filter that accepts every event. */
  public static final EventFilter ANY = new EventFilter(null, null, null);

  public EventFilter {
    categories = categories == null ? Set.of() : Set.copyOf(categories);
    priorities = priorities == null ? Set.of() : Set.copyOf(priorities);
    eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
  }

  public static EventFilter forCategories(EventCategory... categories) {
    return new EventFilter(Set.copyOf(Arrays.asList(categories)), null, null);
  }

  public static EventFilter forPriorities(EventPriority... priorities) {
    return new EventFilter(null, Set.copyOf(Arrays.asList(priorities)), null);
  }

  @SafeVarargs
  public static EventFilter forTypes(Class<? extends UiEvent>... types) {
    return new EventFilter(null, null, Set.copyOf(Arrays.asList(types)));
  }

  public EventFilter withCategories(Collection<EventCategory> values) {
    return new EventFilter(Set.copyOf(values), priorities, eventTypes);
  }

  public EventFilter withPriorities(Collection<EventPriority> values) {
    return new EventFilter(categories, Set.copyOf(values), eventTypes);
  }

  /**
   * Evaluates the filter against an event.
   *
   * @param event candidate event; {@code null} never matches
   * @return {@code true} when every non-empty dimension accepts the event
   */
  public boolean matches(UiEvent event) {
    if (event == null) {
      return false;
    }
    if (!categories.isEmpty() && !categories.contains(event.category())) {
      return false;
    }
    if (!priorities.isEmpty() && !priorities.contains(event.priority())) {
      return false;
    }
    return eventTypes.isEmpty() || eventTypes.contains(event.getClass());
  }
}
