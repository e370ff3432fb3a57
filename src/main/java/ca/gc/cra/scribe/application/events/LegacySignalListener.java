package ca.gc.cra.scribe.application.events;

/**
 * Subscriber to a {@link LegacyChannel}. Unlike typed handlers, legacy listeners are held strongly
 * until {@link EventBus#disconnectLegacy(LegacyChannel, LegacySignalListener)} is called.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LegacySignalListener {
  void onSignal(LegacySignal signal);
}
