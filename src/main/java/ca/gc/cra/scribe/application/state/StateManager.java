package ca.gc.cra.scribe.application.state;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.application.port.StatePersistencePort;
import ca.gc.cra.scribe.domain.events.ErrorOccurredEvent;
import ca.gc.cra.scribe.domain.state.JsonValues;
import ca.gc.cra.scribe.domain.state.StateChange;
import ca.gc.cra.scribe.domain.state.StatePath;
import ca.gc.cra.scribe.logging.Logs;
import ca.gc.cra.scribe.validation.Numbers;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Hierarchical key/value store for UI state with undo/redo and selective
 * persistence.
 * <p><strong>Why:</strong> Gives views a single place to keep selections, layout and preferences, with
 * change notification and history that survive across components.</p>
 * <p><strong>Role:</strong> Application service layered on the {@link EventBus}; injected into every
 * component as a common service.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store JSON-compatible values under flat keys or nested paths, deep-copied on write.</li>
 *   <li>Record tracked changes on a bounded history stack and replay them through undo/redo.</li>
 *   <li>Notify local {@link StateListener}s and publish {@code UiStateChangedEvent}s.</li>
 *   <li>Rewrite the full persistent snapshot whenever a persistent key changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Confined to the UI thread.</p>
 * <p><strong>Observability:</strong> Counts {@code state.changes} and {@code state.persist.failures};
 * persistence failures are logged and published as {@code ErrorOccurredEvent}s.</p>
 *
 * @since 0.1.0
 */
public final class StateManager {
  private static final Logger log = LoggerFactory.getLogger(StateManager.class);
  private static final int LOGGED_VALUE_BYTES = 256;

  /** History capacity used when none is configured. */
  public static final int DEFAULT_HISTORY_SIZE = 100;

  static final String PERSISTENCE_ERROR_TYPE = "StatePersistence";

  private final EventBus eventBus;
  private final StatePersistencePort persistence;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final int maxHistorySize;

  private final Map<String, Object> state = new LinkedHashMap<>();
  private final Deque<StateChange> history = new ArrayDeque<>();
  private final Deque<StateChange> redoStack = new ArrayDeque<>();
  private final Set<String> historyExcludedKeys = new HashSet<>();
  private final Set<String> persistentKeys = new LinkedHashSet<>();
  private final List<StateListener> listeners = new CopyOnWriteArrayList<>();
  private boolean historyEnabled = true;
  private Path persistencePath;

  /**
   * Creates a state manager with the system clock, default history capacity and no metrics.
   *
   * @param eventBus bus receiving state-changed events
   * @param persistence snapshot store for persistent keys
   */
  public StateManager(EventBus eventBus, StatePersistencePort persistence) {
    this(eventBus, persistence, ClockPort.SYSTEM, MetricsPort.NO_OP, DEFAULT_HISTORY_SIZE);
  }

  /**
   * Creates a state manager.
   *
   * @param eventBus bus receiving state-changed events; never {@code null}
   * @param persistence snapshot store for persistent keys; never {@code null}
   * @param clock time source for history records; never {@code null}
   * @param metrics metrics sink; never {@code null}
   * @param maxHistorySize number of undoable changes retained; must be positive
   */
  public StateManager(
      EventBus eventBus,
      StatePersistencePort persistence,
      ClockPort clock,
      MetricsPort metrics,
      int maxHistorySize) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    this.persistence = Objects.requireNonNull(persistence, "persistence");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.maxHistorySize =
        (int) Numbers.requireRange("maxHistorySize", maxHistorySize, 1, Integer.MAX_VALUE);
  }

  // Flat state

  /**
   * Returns the value stored under {@code key}.
   *
   * @param key state key
   * @param defaultValue value returned when the key is absent
   * @return a copy of the stored value, or {@code defaultValue}
   */
  public Object get(String key, Object defaultValue) {
    if (!state.containsKey(key)) {
      return defaultValue;
    }
    return JsonValues.deepCopy(key, state.get(key));
  }

  public Object get(String key) {
    return get(key, null);
  }

  public boolean contains(String key) {
    return state.containsKey(key);
  }

  public Set<String> keys() {
    return Set.copyOf(state.keySet());
  }

  public void set(String key, Object value) {
    set(key, value, true);
  }

  /**
   * Stores {@code value} under {@code key}. Does nothing when the key already holds an equal value.
   *
   * @param key state key; never {@code null}
   * @param value JSON-compatible value; deep-copied
   * @param trackHistory whether the change may be undone
   * @throws IllegalArgumentException if {@code value} is not JSON-compatible
   */
  public void set(String key, Object value, boolean trackHistory) {
    Objects.requireNonNull(key, "key");
    Object copy = JsonValues.deepCopy(key, value);
    Object oldValue = state.get(key);
    if (state.containsKey(key) && Objects.equals(oldValue, copy)) {
      return;
    }
    if (trackHistory && isTracked(key)) {
      addToHistory(key, oldValue, copy);
    }
    state.put(key, copy);
    afterFlatChange(key, copy);
    if (persistentKeys.contains(key)) {
      persistState();
    }
  }

  public void clear(String key) {
    clear(key, true);
  }

  /**
   * Removes {@code key}. Does nothing when the key is absent.
   */
  public void clear(String key, boolean trackHistory) {
    if (!state.containsKey(key)) {
      return;
    }
    Object oldValue = state.remove(key);
    if (trackHistory && isTracked(key)) {
      addToHistory(key, oldValue, null);
    }
    afterFlatChange(key, null);
    if (persistentKeys.contains(key)) {
      persistState();
    }
  }

  public void clearAll() {
    clearAll(true);
  }

  /**
   * Removes every key, recording one history entry and one notification per key.
   */
  public void clearAll(boolean trackHistory) {
    List<String> keys = new ArrayList<>(state.keySet());
    if (keys.isEmpty()) {
      return;
    }
    boolean persist = false;
    for (String key : keys) {
      Object oldValue = state.remove(key);
      if (trackHistory && isTracked(key)) {
        addToHistory(key, oldValue, null);
      }
      afterFlatChange(key, null);
      persist |= persistentKeys.contains(key);
    }
    if (persist) {
      persistState();
    }
    log.debug("Cleared {} state keys", keys.size());
  }

  // Nested state

  /**
   * Returns the value at {@code path}.
   *
   * @param path non-empty key path
   * @param defaultValue value returned when any path segment is missing
   * @return a copy of the stored value, or {@code defaultValue}
   */
  public Object getNested(List<String> path, Object defaultValue) {
    List<String> segments = StatePath.require(path);
    Object current = state;
    for (String segment : segments) {
      if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
        return defaultValue;
      }
      current = map.get(segment);
    }
    return JsonValues.deepCopy(StatePath.join(segments), current);
  }

  public Object getNested(List<String> path) {
    return getNested(path, null);
  }

  public void setNested(List<String> path, Object value) {
    setNested(path, value, true);
  }

  /**
   * Stores {@code value} at {@code path}, creating intermediate mappings and replacing non-mapping
   * intermediates. Does nothing when the path already holds an equal value.
   *
   * @throws IllegalArgumentException if {@code path} is empty or {@code value} is not JSON-compatible
   */
  public void setNested(List<String> path, Object value, boolean trackHistory) {
    List<String> segments = StatePath.require(path);
    String historyKey = StatePath.join(segments);
    Object copy = JsonValues.deepCopy(historyKey, value);
    Object oldValue = getNested(segments, null);
    if (Objects.equals(oldValue, copy)) {
      return;
    }

    Map<String, Object> parent = state;
    for (String segment : segments.subList(0, segments.size() - 1)) {
      parent = childMap(parent, segment);
    }
    parent.put(segments.get(segments.size() - 1), copy);

    if (trackHistory && isTracked(historyKey)) {
      addToHistory(historyKey, oldValue, copy);
    }
    afterNestedChange(segments, historyKey, copy);
    if (touchesPersistentKey(segments)) {
      persistState();
    }
  }

  public void clearNested(List<String> path) {
    clearNested(path, true);
  }

  /**
   * Removes the value at {@code path} and then every ancestor mapping left empty by the removal. The
   * root store itself is never removed. Does nothing when the path holds no value.
   */
  public void clearNested(List<String> path, boolean trackHistory) {
    List<String> segments = StatePath.require(path);
    Object oldValue = getNested(segments, null);
    if (oldValue == null) {
      return;
    }
    Map<String, Object> parent = parentOf(segments);
    if (parent == null) {
      return;
    }
    parent.remove(segments.get(segments.size() - 1));
    removeEmptyAncestors(segments);

    String historyKey = StatePath.join(segments);
    if (trackHistory && isTracked(historyKey)) {
      addToHistory(historyKey, oldValue, null);
    }
    afterNestedChange(segments, historyKey, null);
    if (touchesPersistentKey(segments)) {
      persistState();
    }
  }

  // History

  /**
   * Reverts the most recent tracked change.
   *
   * @return {@code false} when there is nothing to undo
   */
  public boolean undo() {
    StateChange change = history.pollLast();
    if (change == null) {
      return false;
    }
    redoStack.addLast(change);
    apply(change.key(), change.oldValue());
    log.debug("Undid change to {}", change.key());
    return true;
  }

  /**
   * Re-applies the most recently undone change.
   *
   * @return {@code false} when there is nothing to redo
   */
  public boolean redo() {
    StateChange change = redoStack.pollLast();
    if (change == null) {
      return false;
    }
    pushHistory(change);
    apply(change.key(), change.newValue());
    log.debug("Redid change to {}", change.key());
    return true;
  }

  public boolean canUndo() {
    return !history.isEmpty();
  }

  public boolean canRedo() {
    return !redoStack.isEmpty();
  }

  /**
   * Returns tracked changes, oldest first.
   */
  public List<StateChange> getHistory() {
    return List.copyOf(history);
  }

  public void clearHistory() {
    history.clear();
    redoStack.clear();
    log.debug("State history cleared");
  }

  public void enableHistory(boolean enabled) {
    this.historyEnabled = enabled;
    log.debug("State history {}", enabled ? "enabled" : "disabled");
  }

  public boolean isHistoryEnabled() {
    return historyEnabled;
  }

  /**
   * Stops recording history for {@code key}. For nested state, pass the dot-joined path.
   */
  public void excludeFromHistory(String key) {
    historyExcludedKeys.add(Objects.requireNonNull(key, "key"));
  }

  public void includeInHistory(String key) {
    historyExcludedKeys.remove(key);
  }

  // Persistence

  public void setPersistencePath(Path path) {
    this.persistencePath = Objects.requireNonNull(path, "path");
    log.debug("State persistence path set to {}", path);
  }

  public Optional<Path> persistencePath() {
    return Optional.ofNullable(persistencePath);
  }

  public void markAsPersistent(String key) {
    persistentKeys.add(Objects.requireNonNull(key, "key"));
    log.debug("Key marked as persistent: {}", key);
  }

  public void unmarkAsPersistent(String key) {
    if (persistentKeys.remove(key)) {
      log.debug("Key unmarked as persistent: {}", key);
    }
  }

  public Set<String> persistentKeys() {
    return Set.copyOf(persistentKeys);
  }

  /**
   * Replays the persisted snapshot into the store without recording history.
   *
   * @return number of keys read from the snapshot; zero when no path is set, no snapshot exists, or
   *     reading fails
   */
  public int loadPersistentState() {
    if (persistencePath == null) {
      log.warn("Cannot load persistent state: no persistence path set");
      return 0;
    }
    Optional<Map<String, Object>> snapshot;
    try {
      snapshot = persistence.read(persistencePath);
    } catch (IOException | IllegalArgumentException ex) {
      reportPersistenceFailure("Error loading persistent state from " + persistencePath, ex);
      return 0;
    }
    if (snapshot.isEmpty()) {
      log.debug("Persistent state file not found: {}", persistencePath);
      return 0;
    }
    Map<String, Object> values = snapshot.get();
    values.forEach((key, value) -> set(key, value, false));
    log.info("Loaded {} persistent state keys from {}", values.size(), persistencePath);
    return values.size();
  }

  // Listeners

  public void addStateListener(StateListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean removeStateListener(StateListener listener) {
    return listeners.remove(listener);
  }

  private boolean isTracked(String key) {
    return historyEnabled && !historyExcludedKeys.contains(key);
  }

  private void addToHistory(String key, Object oldValue, Object newValue) {
    pushHistory(new StateChange(key, oldValue, newValue, clock.now()));
    redoStack.clear();
  }

  private void pushHistory(StateChange change) {
    while (history.size() >= maxHistorySize) {
      history.pollFirst();
    }
    history.addLast(change);
  }

  private void apply(String key, Object value) {
    if (StatePath.isNested(key)) {
      List<String> path = StatePath.split(key);
      if (value == null) {
        clearNested(path, false);
      } else {
        setNested(path, value, false);
      }
    } else if (value == null) {
      clear(key, false);
    } else {
      set(key, value, false);
    }
  }

  private void afterFlatChange(String key, Object value) {
    metrics.increment("state.changes");
    Object snapshot = JsonValues.frozenCopy(key, value);
    for (StateListener listener : listeners) {
      try {
        listener.onStateChanged(key, snapshot);
      } catch (RuntimeException ex) {
        log.error("State listener failed for key {}", key, ex);
      }
    }
    eventBus.emitUiStateChanged(key, snapshot);
    if (log.isDebugEnabled()) {
      log.debug("State changed: {}={}", key, Logs.truncate(String.valueOf(snapshot), LOGGED_VALUE_BYTES));
    }
  }

  private void afterNestedChange(List<String> path, String historyKey, Object value) {
    metrics.increment("state.changes");
    Object snapshot = JsonValues.frozenCopy(historyKey, value);
    for (StateListener listener : listeners) {
      try {
        listener.onNestedStateChanged(path, snapshot);
      } catch (RuntimeException ex) {
        log.error("State listener failed for path {}", historyKey, ex);
      }
    }
    eventBus.emitUiStateChanged(historyKey, snapshot);
    if (log.isDebugEnabled()) {
      log.debug("Nested state changed: {}={}", historyKey,
          Logs.truncate(String.valueOf(snapshot), LOGGED_VALUE_BYTES));
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> childMap(Map<String, Object> parent, String segment) {
    Object child = parent.get(segment);
    if (child instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    Map<String, Object> created = new LinkedHashMap<>();
    parent.put(segment, created);
    return created;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> parentOf(List<String> path) {
    Map<String, Object> current = state;
    for (String segment : path.subList(0, path.size() - 1)) {
      Object child = current.get(segment);
      if (!(child instanceof Map<?, ?> map)) {
        return null;
      }
      current = (Map<String, Object>) map;
    }
    return current;
  }

  private void removeEmptyAncestors(List<String> path) {
    for (int depth = path.size() - 1; depth >= 1; depth--) {
      List<String> ancestor = path.subList(0, depth);
      Map<String, Object> parent = parentOf(ancestor);
      if (parent == null) {
        return;
      }
      Object node = parent.get(ancestor.get(ancestor.size() - 1));
      if (node instanceof Map<?, ?> map && map.isEmpty()) {
        parent.remove(ancestor.get(ancestor.size() - 1));
      } else {
        return;
      }
    }
  }

  private boolean touchesPersistentKey(List<String> path) {
    for (String segment : path) {
      if (persistentKeys.contains(segment)) {
        return true;
      }
    }
    return false;
  }

  private void persistState() {
    if (persistencePath == null) {
      log.warn("Cannot persist state: no persistence path set");
      return;
    }
    Map<String, Object> snapshot = new LinkedHashMap<>();
    for (String key : persistentKeys) {
      if (state.containsKey(key)) {
        snapshot.put(key, state.get(key));
      }
    }
    try {
      persistence.write(persistencePath, snapshot);
      log.debug("State persisted to {}", persistencePath);
    } catch (IOException ex) {
      reportPersistenceFailure("Error persisting state to " + persistencePath, ex);
    }
  }

  private void reportPersistenceFailure(String message, Exception ex) {
    metrics.increment("state.persist.failures");
    log.error(message, ex);
    eventBus.emit(new ErrorOccurredEvent(PERSISTENCE_ERROR_TYPE, message + ": " + ex.getMessage()));
  }
}
