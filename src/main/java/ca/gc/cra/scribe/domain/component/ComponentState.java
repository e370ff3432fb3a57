package ca.gc.cra.scribe.domain.component;

/**
 * Lifecycle state of a registered component.
 *
 * <pre>
 * REGISTERED -> INITIALIZING -> INITIALIZED <-> ACTIVE <-> INACTIVE -> DISPOSING -> DISPOSED
 * </pre>
 * {@link #ERROR} is reachable from initialization, disposal, activation and deactivation.
 *
 * @since 0.1.0
 */
public enum ComponentState {
  REGISTERED,
  INITIALIZING,
  INITIALIZED,
  ACTIVE,
  INACTIVE,
  DISPOSING,
  DISPOSED,
  ERROR;

  /**
   * Indicates whether a component in this state holds usable instances.
   *
   * @return {@code true} for {@link #INITIALIZED}, {@link #ACTIVE} and {@link #INACTIVE}
   */
  public boolean isLive() {
    return this == INITIALIZED || this == ACTIVE || this == INACTIVE;
  }
}
