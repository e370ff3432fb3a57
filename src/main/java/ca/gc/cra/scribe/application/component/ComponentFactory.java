package ca.gc.cra.scribe.application.component;

/**
 * Creates component instances from their resolved dependencies.
 *
 * <p>Factories take precedence over direct construction. Exceptions thrown here move the component to
 * the error state; they never reach the caller of {@code createInstance}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ComponentFactory {
  /**
   * Creates an instance.
   *
   * @param dependencies declared dependencies, common services and component configuration
   * @return new instance; must not be {@code null}
   * @throws Exception when construction fails
   */
  Object create(ResolvedDependencies dependencies) throws Exception;
}
