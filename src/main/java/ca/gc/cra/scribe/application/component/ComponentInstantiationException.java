package ca.gc.cra.scribe.application.component;

/**
 * Raised when the registry cannot produce an instance, for example when a class exposes neither a
 * {@link ResolvedDependencies} constructor nor a public no-arg constructor.
 *
 * @since 0.1.0
 */
public final class ComponentInstantiationException extends Exception {
  private static final long serialVersionUID = 1L;

  public ComponentInstantiationException(String message) {
    super(message);
  }
}
