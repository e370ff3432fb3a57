package ca.gc.cra.scribe.domain.component;

/**
 * Points in the component lifecycle where registered hooks run.
 *
 * @since 0.1.0
 */
public enum LifecycleHookType {
  AFTER_INITIALIZE,
  BEFORE_DISPOSE,
  AFTER_ACTIVATE,
  BEFORE_DEACTIVATE
}
