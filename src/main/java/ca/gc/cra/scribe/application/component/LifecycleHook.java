package ca.gc.cra.scribe.application.component;

/**
 * Callback run by the registry at a {@link ca.gc.cra.scribe.domain.component.LifecycleHookType} point.
 *
 * <p>The instance is {@code null} for transient components, which the registry does not hold. A failing
 * hook is logged and reported but does not stop the transition or the remaining hooks.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LifecycleHook {
  void run(Object instance) throws Exception;
}
