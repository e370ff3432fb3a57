package ca.gc.cra.scribe.infrastructure.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.events.EventHandler;
import ca.gc.cra.scribe.domain.events.ErrorOccurredEvent;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoggingErrorReporterTest {
  private final List<ErrorOccurredEvent> errors = new ArrayList<>();
  private final EventHandler<ErrorOccurredEvent> handler = errors::add;

  @Test
  void reportIsPublishedOnBus() {
    EventBus bus = new EventBus();
    bus.registerHandler(ErrorOccurredEvent.class, handler);
    LoggingErrorReporter reporter = new LoggingErrorReporter(bus);

    reporter.report("ComponentLifecycle", "editor failed", new IOException("disk"));
    reporter.report(null, null, null);

    assertEquals(2, errors.size());
    assertEquals("ComponentLifecycle", errors.get(0).errorType());
    assertEquals("editor failed", errors.get(0).errorMessage());
    assertEquals("Unknown", errors.get(1).errorType());
    assertEquals("", errors.get(1).errorMessage());
  }
}
