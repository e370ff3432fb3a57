package ca.gc.cra.scribe.application.port;

/**
 * <strong>What:</strong> Port through which core services report failures to the host application.
 * <p><strong>Why:</strong> Components and the registry surface errors without depending on dialog or
 * notification code, which lives outside the core.</p>
 * <p><strong>Role:</strong> Fourth common service injected into every component next to the event bus,
 * state manager and registry.</p>
 * <p><strong>Thread-safety:</strong> Called on the UI thread only.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.scribe.infrastructure.errors.LoggingErrorReporter
 */
public interface ErrorReporter {
  /**
   * Reports a failure. Implementations must not throw.
   *
   * @param errorType short classification such as {@code ComponentLifecycle}; never {@code null}
   * @param message human-readable description; never {@code null}
   * @param cause underlying exception; may be {@code null}
   */
  void report(String errorType, String message, Throwable cause);

  /** Reporter that discards every report. */
  ErrorReporter NO_OP = (errorType, message, cause) -> {};
}
