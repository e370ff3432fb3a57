package ca.gc.cra.scribe.infrastructure.errors;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.port.ErrorReporter;
import ca.gc.cra.scribe.domain.events.ErrorOccurredEvent;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ErrorReporter} that logs each report and republishes it as an
 * {@link ErrorOccurredEvent}.
 * <p><strong>Why:</strong> Lets a status bar or dialog subscribe to errors through the bus instead of
 * being called by every service.</p>
 * <p><strong>Thread-safety:</strong> Same as the {@link EventBus} it publishes to.</p>
 *
 * @since 0.1.0
 */
public final class LoggingErrorReporter implements ErrorReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

  private final EventBus eventBus;

  public LoggingErrorReporter(EventBus eventBus) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
  }

  @Override
  public void report(String errorType, String message, Throwable cause) {
    String type = errorType == null || errorType.isBlank() ? "Unknown" : errorType;
    String text = message == null ? "" : message;
    if (cause == null) {
      log.error("[{}] {}", type, text);
    } else {
      log.error("[{}] {}", type, text, cause);
    }
    try {
      eventBus.emit(new ErrorOccurredEvent(type, text));
    } catch (RuntimeException ex) {
      log.warn("Failed to publish error report [{}]", type, ex);
    }
  }
}
