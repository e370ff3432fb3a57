package ca.gc.cra.scribe.domain.component;

/**
 * Fallback teardown capability, invoked on disposal only when the instance is not {@link Disposable}.
 *
 * @since 0.1.0
 */
public interface Cleanable {
  void cleanup() throws Exception;
}
