package ca.gc.cra.scribe.domain.component;

/**
 * Capability of components that react to activation changes, for example a view gaining focus.
 *
 * @since 0.1.0
 */
public interface Activatable {
  void activate() throws Exception;

  void deactivate() throws Exception;
}
