package ca.gc.cra.scribe.domain.component;

/**
 * Role a registered component plays in the application.
 *
 * @since 0.1.0
 */
public enum ComponentType {
  VIEW,
  VIEW_MODEL,
  SERVICE,
  UTILITY,
  DIALOG,
  CUSTOM
}
