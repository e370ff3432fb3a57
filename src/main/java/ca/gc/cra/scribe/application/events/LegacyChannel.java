package ca.gc.cra.scribe.application.events;

/**
 * Untyped notification channels kept for older subscribers.
 *
 * <p>New code should register typed handlers on the {@link EventBus}. Each channel lists the argument
 * shape delivered in {@link LegacySignal#args()}.</p>
 *
 * @since 0.1.0
 */
public enum LegacyChannel {
  /** {@code (documentId)} */
  DOCUMENT_SELECTED("document_selected"),
  /** {@code (documentId)} */
  DOCUMENT_LOADED("document_loaded"),
  /** {@code (documentId)} */
  DOCUMENT_SAVED("document_saved"),
  /** {@code (documentId)} */
  DOCUMENT_MODIFIED("document_modified"),
  /** {@code (documentId)} */
  DOCUMENT_CREATED("document_created"),
  /** {@code (documentId)} */
  DOCUMENT_DELETED("document_deleted"),
  /** {@code (projectId)} */
  PROJECT_LOADED("project_loaded"),
  /** {@code (projectId)} */
  PROJECT_SAVED("project_saved"),
  /** No arguments. */
  PROJECT_CLOSED("project_closed"),
  /** {@code (projectId)} */
  PROJECT_CREATED("project_created"),
  /** {@code (themeName)} */
  UI_THEME_CHANGED("ui_theme_changed"),
  /** {@code (stateKey, stateValue)} */
  UI_STATE_CHANGED("ui_state_changed"),
  /** {@code (errorType, errorMessage)} */
  ERROR_OCCURRED("error_occurred"),
  /** {@code (event)}; fired for every emitted event. */
  EVENT_EMITTED("event_emitted");

  private final String channelName;

  LegacyChannel(String channelName) {
    this.channelName = channelName;
  }

  /**
   * Returns the historical channel name.
   *
   * @return snake_case channel name
   */
  public String channelName() {
    return channelName;
  }
}
