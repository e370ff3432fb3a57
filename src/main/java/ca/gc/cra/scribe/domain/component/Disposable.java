package ca.gc.cra.scribe.domain.component;

/**
 * Capability of components that release resources when the registry disposes them.
 *
 * @since 0.1.0
 * @see Cleanable
 */
public interface Disposable {
  void dispose() throws Exception;
}
