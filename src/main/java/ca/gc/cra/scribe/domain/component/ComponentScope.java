package ca.gc.cra.scribe.domain.component;

/**
 * Instance-sharing policy applied by the component registry.
 *
 * @since 0.1.0
 */
public enum ComponentScope {
  /** One shared instance for the registry's lifetime. */
  SINGLETON,
  /** A new instance on every request; the registry does not cache it. */
  TRANSIENT,
  /** One shared instance per caller-supplied scope id. */
  SCOPED
}
