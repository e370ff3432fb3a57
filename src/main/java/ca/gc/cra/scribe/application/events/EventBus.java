package ca.gc.cra.scribe.application.events;

import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.events.DocumentCreatedEvent;
import ca.gc.cra.scribe.domain.events.DocumentDeletedEvent;
import ca.gc.cra.scribe.domain.events.DocumentLoadedEvent;
import ca.gc.cra.scribe.domain.events.DocumentModifiedEvent;
import ca.gc.cra.scribe.domain.events.DocumentSavedEvent;
import ca.gc.cra.scribe.domain.events.DocumentSelectedEvent;
import ca.gc.cra.scribe.domain.events.ErrorOccurredEvent;
import ca.gc.cra.scribe.domain.events.EventFilter;
import ca.gc.cra.scribe.domain.events.ProjectClosedEvent;
import ca.gc.cra.scribe.domain.events.ProjectCreatedEvent;
import ca.gc.cra.scribe.domain.events.ProjectLoadedEvent;
import ca.gc.cra.scribe.domain.events.ProjectSavedEvent;
import ca.gc.cra.scribe.domain.events.UiEvent;
import ca.gc.cra.scribe.domain.events.UiStateChangedEvent;
import ca.gc.cra.scribe.domain.events.UiThemeChangedEvent;
import ca.gc.cra.scribe.validation.Numbers;
import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Typed publish/subscribe hub for SCRIBE UI events.
 * <p><strong>Why:</strong> Decouples views, view models and services so producers never reference their
 * consumers.</p>
 * <p><strong>Role:</strong> Leaf application service; the state manager and component registry publish
 * through it and it is injected into every component as a common service.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold handlers weakly, keyed by exact event class, with optional {@link EventFilter}s.</li>
 *   <li>Dispatch synchronously: unfiltered handlers, then matching filtered handlers, then legacy
 *   channels. Each handler is isolated from the failures of the others.</li>
 *   <li>Keep a bounded FIFO history of emitted events for debugging and tests.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Confined to the UI thread.</p>
 * <p><strong>Observability:</strong> Counts {@code events.emitted} and {@code events.handler.failures};
 * logs every event at DEBUG when debug mode is enabled.</p>
 *
 * @since 0.1.0
 */
public final class EventBus {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);
  private static final StackWalker STACK_WALKER = StackWalker.getInstance();
  private static final String BUS_CLASS = EventBus.class.getName();

  /** History capacity used when none is configured. */
  public static final int DEFAULT_HISTORY_SIZE = 100;

  private final Map<Class<?>, List<WeakReference<EventHandler<?>>>> handlers = new HashMap<>();
  private final Map<Class<?>, List<FilteredRegistration>> filteredHandlers = new HashMap<>();
  private final Map<LegacyChannel, List<LegacySignalListener>> legacyListeners =
      new EnumMap<>(LegacyChannel.class);
  private final Deque<UiEvent> history = new ArrayDeque<>();
  private final int maxHistorySize;
  private final MetricsPort metrics;
  private boolean debugMode;

  /**
   * Creates a bus with the default history capacity and no metrics.
   */
  public EventBus() {
    this(DEFAULT_HISTORY_SIZE, MetricsPort.NO_OP);
  }

  /**
   * Creates a bus.
   *
   * @param maxHistorySize number of events retained in history; must be positive
   * @param metrics metrics sink; never {@code null}
   * @throws IllegalArgumentException if {@code maxHistorySize} is not positive
   */
  public EventBus(int maxHistorySize, MetricsPort metrics) {
    this.maxHistorySize = (int) Numbers.requireRange("maxHistorySize", maxHistorySize, 1, Integer.MAX_VALUE);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public void setDebugMode(boolean enabled) {
    this.debugMode = enabled;
    log.debug("Event bus debug mode {}", enabled ? "enabled" : "disabled");
  }

  public boolean isDebugMode() {
    return debugMode;
  }

  /**
   * Registers an unfiltered handler for events whose runtime class is exactly {@code eventType}.
   *
   * @param eventType concrete event class
   * @param handler callback; held weakly
   * @param <T> event type
   * @return {@code false} when the identical handler was already registered for {@code eventType}
   */
  public <T extends UiEvent> boolean registerHandler(
      Class<T> eventType, EventHandler<? super T> handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    List<WeakReference<EventHandler<?>>> refs =
        handlers.computeIfAbsent(eventType, key -> new ArrayList<>());
    for (EventHandler<?> existing : liveHandlers(refs)) {
      if (existing == handler) {
        log.debug("Handler already registered for {}", eventType.getSimpleName());
        return false;
      }
    }
    refs.add(new WeakReference<EventHandler<?>>(handler));
    log.debug("Registered handler for {}", eventType.getSimpleName());
    return true;
  }

  /**
   * Registers a handler that receives events of exactly {@code eventType} only when {@code filter}
   * matches them.
   *
   * @param eventType concrete event class
   * @param handler callback; held weakly
   * @param filter filter applied before dispatch
   * @param <T> event type
   */
  public <T extends UiEvent> void registerFilteredHandler(
      Class<T> eventType, EventHandler<? super T> handler, EventFilter filter) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(filter, "filter");
    filteredHandlers
        .computeIfAbsent(eventType, key -> new ArrayList<>())
        .add(new FilteredRegistration(new WeakReference<EventHandler<?>>(handler), filter));
    log.debug("Registered filtered handler for {}", eventType.getSimpleName());
  }

  /**
   * Removes an unfiltered handler. Collected handlers are treated as absent.
   *
   * @return {@code true} if the handler was registered for {@code eventType}
   */
  public boolean unregisterHandler(Class<? extends UiEvent> eventType, EventHandler<?> handler) {
    List<WeakReference<EventHandler<?>>> refs = handlers.get(eventType);
    if (refs == null) {
      return false;
    }
    boolean removed = false;
    Iterator<WeakReference<EventHandler<?>>> iterator = refs.iterator();
    while (iterator.hasNext()) {
      EventHandler<?> existing = iterator.next().get();
      if (existing == null) {
        iterator.remove();
      } else if (existing == handler) {
        iterator.remove();
        removed = true;
      }
    }
    if (refs.isEmpty()) {
      handlers.remove(eventType);
    }
    return removed;
  }

  /**
   * Removes every filtered registration of {@code handler} for {@code eventType}.
   *
   * @return {@code true} if at least one registration was removed
   */
  public boolean unregisterFilteredHandler(Class<? extends UiEvent> eventType, EventHandler<?> handler) {
    List<FilteredRegistration> registrations = filteredHandlers.get(eventType);
    if (registrations == null) {
      return false;
    }
    int before = countLive(registrations);
    registrations.removeIf(reg -> reg.handler().get() == null || reg.handler().get() == handler);
    boolean removed = countLive(registrations) < before;
    if (registrations.isEmpty()) {
      filteredHandlers.remove(eventType);
    }
    return removed;
  }

  /**
   * Returns the number of live handlers, filtered and unfiltered, registered for {@code eventType}.
   */
  public int handlerCount(Class<? extends UiEvent> eventType) {
    int count = liveHandlers(handlers.get(eventType)).size();
    List<FilteredRegistration> registrations = filteredHandlers.get(eventType);
    if (registrations != null) {
      registrations.removeIf(reg -> reg.handler().get() == null);
      count += registrations.size();
    }
    return count;
  }

  /**
   * Publishes an event.
   *
   * <p>If the event carries no source, a copy is published whose source names the calling class and
   * method. The event is appended to history and then dispatched synchronously. Handler failures are
   * logged and never reach the caller.</p>
   *
   * @param event event to publish; never {@code null}
   */
  public void emit(UiEvent event) {
    Objects.requireNonNull(event, "event");
    UiEvent effective = event.metadata().hasSource()
        ? event
        : event.withMetadata(event.metadata().withSource(inferSource()));

    appendHistory(effective);
    metrics.increment("events.emitted");
    if (debugMode) {
      log.debug("Emitting event: {} - {}", effective.getClass().getSimpleName(), effective);
    }

    Class<?> type = effective.getClass();
    for (EventHandler<?> handler : liveHandlers(handlers.get(type))) {
      dispatch(handler, effective, "event handler");
    }

    List<FilteredRegistration> registrations = filteredHandlers.get(type);
    if (registrations != null) {
      for (FilteredRegistration registration : List.copyOf(registrations)) {
        EventHandler<?> handler = registration.handler().get();
        if (handler == null) {
          registrations.remove(registration);
        } else if (registration.filter().matches(effective)) {
          dispatch(handler, effective, "filtered event handler");
        }
      }
    }

    emitLegacySignals(effective);
  }

  /**
   * Returns every retained event, oldest first.
   */
  public List<UiEvent> getHistory() {
    return getHistory(null, null);
  }

  /**
   * Returns retained events, oldest first.
   *
   * @param maxEvents cap applied after filtering, keeping the most recent events; {@code null} for no cap
   * @param filter filter applied to history; {@code null} for all events
   * @return immutable list of events
   */
  public List<UiEvent> getHistory(Integer maxEvents, EventFilter filter) {
    List<UiEvent> events = new ArrayList<>(history.size());
    for (UiEvent event : history) {
      if (filter == null || filter.matches(event)) {
        events.add(event);
      }
    }
    if (maxEvents != null) {
      Numbers.requireRange("maxEvents", maxEvents, 0, Integer.MAX_VALUE);
      if (events.size() > maxEvents) {
        events = events.subList(events.size() - maxEvents, events.size());
      }
    }
    return List.copyOf(events);
  }

  public void clearHistory() {
    history.clear();
    log.debug("Event history cleared");
  }

  public int maxHistorySize() {
    return maxHistorySize;
  }

  /**
   * Subscribes a listener to a legacy channel. Listeners are held strongly.
   *
   * @return {@code false} if the listener was already connected to {@code channel}
   */
  public boolean connectLegacy(LegacyChannel channel, LegacySignalListener listener) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(listener, "listener");
    List<LegacySignalListener> listeners =
        legacyListeners.computeIfAbsent(channel, key -> new ArrayList<>());
    if (listeners.contains(listener)) {
      return false;
    }
    listeners.add(listener);
    return true;
  }

  public boolean disconnectLegacy(LegacyChannel channel, LegacySignalListener listener) {
    List<LegacySignalListener> listeners = legacyListeners.get(channel);
    return listeners != null && listeners.remove(listener);
  }

  public void emitDocumentSelected(String documentId) {
    emit(new DocumentSelectedEvent(documentId));
  }

  public void emitDocumentLoaded(String documentId) {
    emit(new DocumentLoadedEvent(documentId));
  }

  public void emitDocumentSaved(String documentId) {
    emit(new DocumentSavedEvent(documentId));
  }

  public void emitDocumentModified(String documentId) {
    emit(new DocumentModifiedEvent(documentId));
  }

  public void emitDocumentCreated(String documentId) {
    emit(new DocumentCreatedEvent(documentId));
  }

  public void emitDocumentDeleted(String documentId) {
    emit(new DocumentDeletedEvent(documentId));
  }

  public void emitProjectLoaded(String projectId) {
    emit(new ProjectLoadedEvent(projectId));
  }

  public void emitProjectSaved(String projectId) {
    emit(new ProjectSavedEvent(projectId));
  }

  public void emitProjectClosed() {
    emit(new ProjectClosedEvent());
  }

  public void emitProjectCreated(String projectId) {
    emit(new ProjectCreatedEvent(projectId));
  }

  public void emitUiThemeChanged(String themeName) {
    emit(new UiThemeChangedEvent(themeName));
  }

  public void emitUiStateChanged(String stateKey, Object stateValue) {
    emit(new UiStateChangedEvent(stateKey, stateValue));
  }

  public void emitErrorOccurred(String errorType, String errorMessage) {
    emit(new ErrorOccurredEvent(errorType, errorMessage));
  }

  private void appendHistory(UiEvent event) {
    while (history.size() >= maxHistorySize) {
      history.pollFirst();
    }
    history.addLast(event);
  }

  @SuppressWarnings("unchecked")
  private void dispatch(EventHandler<?> handler, UiEvent event, String handlerKind) {
    try {
      ((EventHandler<UiEvent>) handler).handle(event);
    } catch (RuntimeException ex) {
      metrics.increment("events.handler.failures");
      log.error("Error in {} for {}", handlerKind, event.getClass().getSimpleName(), ex);
    }
  }

  private void emitLegacySignals(UiEvent event) {
    publishLegacy(LegacySignal.of(LegacyChannel.EVENT_EMITTED, event));
    LegacySignal signal = legacySignalFor(event);
    if (signal != null) {
      publishLegacy(signal);
    }
  }

  private void publishLegacy(LegacySignal signal) {
    List<LegacySignalListener> listeners = legacyListeners.get(signal.channel());
    if (listeners == null || listeners.isEmpty()) {
      return;
    }
    for (LegacySignalListener listener : List.copyOf(listeners)) {
      try {
        listener.onSignal(signal);
      } catch (RuntimeException ex) {
        metrics.increment("events.handler.failures");
        log.error("Error in legacy listener on {}", signal.channel().channelName(), ex);
      }
    }
  }

  private static LegacySignal legacySignalFor(UiEvent event) {
    return switch (event.kind()) {
      case DOCUMENT_SELECTED ->
          LegacySignal.of(LegacyChannel.DOCUMENT_SELECTED, ((DocumentSelectedEvent) event).documentId());
      case DOCUMENT_LOADED ->
          LegacySignal.of(LegacyChannel.DOCUMENT_LOADED, ((DocumentLoadedEvent) event).documentId());
      case DOCUMENT_SAVED ->
          LegacySignal.of(LegacyChannel.DOCUMENT_SAVED, ((DocumentSavedEvent) event).documentId());
      case DOCUMENT_MODIFIED ->
          LegacySignal.of(LegacyChannel.DOCUMENT_MODIFIED, ((DocumentModifiedEvent) event).documentId());
      case DOCUMENT_CREATED ->
          LegacySignal.of(LegacyChannel.DOCUMENT_CREATED, ((DocumentCreatedEvent) event).documentId());
      case DOCUMENT_DELETED ->
          LegacySignal.of(LegacyChannel.DOCUMENT_DELETED, ((DocumentDeletedEvent) event).documentId());
      case PROJECT_LOADED ->
          LegacySignal.of(LegacyChannel.PROJECT_LOADED, ((ProjectLoadedEvent) event).projectId());
      case PROJECT_SAVED ->
          LegacySignal.of(LegacyChannel.PROJECT_SAVED, ((ProjectSavedEvent) event).projectId());
      case PROJECT_CLOSED -> LegacySignal.of(LegacyChannel.PROJECT_CLOSED);
      case PROJECT_CREATED ->
          LegacySignal.of(LegacyChannel.PROJECT_CREATED, ((ProjectCreatedEvent) event).projectId());
      case UI_THEME_CHANGED ->
          LegacySignal.of(LegacyChannel.UI_THEME_CHANGED, ((UiThemeChangedEvent) event).themeName());
      case UI_STATE_CHANGED -> {
        UiStateChangedEvent changed = (UiStateChangedEvent) event;
        yield LegacySignal.of(LegacyChannel.UI_STATE_CHANGED, changed.stateKey(), changed.stateValue());
      }
      case ERROR_OCCURRED -> {
        ErrorOccurredEvent error = (ErrorOccurredEvent) event;
        yield LegacySignal.of(LegacyChannel.ERROR_OCCURRED, error.errorType(), error.errorMessage());
      }
      case COMPONENT_REGISTERED,
          COMPONENT_UNREGISTERED,
          COMPONENT_STATE_CHANGED,
          COMPONENT_FAILED,
          CUSTOM -> null;
    };
  }

  private static List<EventHandler<?>> liveHandlers(List<WeakReference<EventHandler<?>>> refs) {
    if (refs == null || refs.isEmpty()) {
      return List.of();
    }
    List<EventHandler<?>> live = new ArrayList<>(refs.size());
    Iterator<WeakReference<EventHandler<?>>> iterator = refs.iterator();
    while (iterator.hasNext()) {
      EventHandler<?> handler = iterator.next().get();
      if (handler == null) {
        iterator.remove();
      } else {
        live.add(handler);
      }
    }
    return live;
  }

  private static int countLive(List<FilteredRegistration> registrations) {
    int count = 0;
    for (FilteredRegistration registration : registrations) {
      if (registration.handler().get() != null) {
        count++;
      }
    }
    return count;
  }

  private static String inferSource() {
    return STACK_WALKER.walk(frames -> frames
        .filter(frame -> !isBusFrame(frame.getClassName()))
        .findFirst()
        .map(frame -> simpleName(frame.getClassName()) + '.' + frame.getMethodName())
        .orElse(""));
  }

  private static boolean isBusFrame(String className) {
    return className.equals(BUS_CLASS) || className.startsWith(BUS_CLASS + '$');
  }

  private static String simpleName(String className) {
    return className.substring(className.lastIndexOf('.') + 1);
  }

  private record FilteredRegistration(WeakReference<EventHandler<?>> handler, EventFilter filter) {}
}
