package ca.gc.cra.scribe.domain.component;

/**
 * Capability of components that need a post-construction setup step.
 *
 * @since 0.1.0
 */
public interface Initializable {
  /**
   * Called once by the registry after construction and before the instance is published.
   *
   * @throws Exception when setup fails; the component moves to {@link ComponentState#ERROR}
   */
  void initialize() throws Exception;
}
