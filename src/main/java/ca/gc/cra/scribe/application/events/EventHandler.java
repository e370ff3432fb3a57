package ca.gc.cra.scribe.application.events;

import ca.gc.cra.scribe.domain.events.UiEvent;

/**
 * Callback receiving events of type {@code T} from the {@link EventBus}.
 *
 * <p>The bus holds handlers weakly. Owners keep a strong reference, typically a field, for as long as
 * the subscription should stay active. A lambda that is only passed to {@code registerHandler} becomes
 * unreachable immediately and may stop receiving events at the next collection.</p>
 *
 * @param <T> handled event type
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventHandler<T extends UiEvent> {
  void handle(T event);
}
