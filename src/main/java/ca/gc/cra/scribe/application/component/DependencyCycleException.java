package ca.gc.cra.scribe.application.component;

import java.util.List;

/**
 * Raised when instance creation re-enters a component that is already being resolved.
 *
 * <p>The exception unwinds through every creation frame on the cycle so each member is moved to the
 * error state, and is converted into a {@code null} result at the outermost {@code createInstance}.</p>
 *
 * @since 0.1.0
 */
public final class DependencyCycleException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final List<String> cycle;

  /**
   * Creates an exception describing {@code cycle}.
   *
   * @param cycle component ids in resolution order, starting and ending with the re-entered id
   */
  public DependencyCycleException(List<String> cycle) {
    super("Dependency cycle detected: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }

  public List<String> cycle() {
    return cycle;
  }
}
