package ca.gc.cra.scribe.domain.events;

/**
 * Tag identifying the concrete {@link UiEvent} variant, used for exhaustive {@code switch} dispatch.
 *
 * @since 0.1.0
 */
public enum EventKind {
  DOCUMENT_SELECTED,
  DOCUMENT_LOADED,
  DOCUMENT_SAVED,
  DOCUMENT_MODIFIED,
  DOCUMENT_CREATED,
  DOCUMENT_DELETED,
  PROJECT_LOADED,
  PROJECT_SAVED,
  PROJECT_CLOSED,
  PROJECT_CREATED,
  UI_THEME_CHANGED,
  UI_STATE_CHANGED,
  ERROR_OCCURRED,
  COMPONENT_REGISTERED,
  COMPONENT_UNREGISTERED,
  COMPONENT_STATE_CHANGED,
  COMPONENT_FAILED,
  CUSTOM
}
