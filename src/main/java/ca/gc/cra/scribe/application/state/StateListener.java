package ca.gc.cra.scribe.application.state;

import java.util.List;

/**
 * Local observer of {@link StateManager} changes.
 *
 * <p>Values are read-only snapshots; {@code null} means the key or path was cleared. Listeners run
 * synchronously on the mutating thread and their exceptions are logged, never propagated.</p>
 *
 * @since 0.1.0
 */
public interface StateListener {
  /**
   * Called after a flat key changes.
   */
  default void onStateChanged(String key, Object value) {}

  /**
   * Called after a nested path changes.
   */
  default void onNestedStateChanged(List<String> path, Object value) {}
}
