package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScribeConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    ScribeConfig config = ScribeConfig.defaults();

    assertEquals(100, config.eventHistorySize());
    assertEquals(100, config.stateHistorySize());
    assertFalse(config.eventDebug());
    assertTrue(config.loadOnStart());
    assertFalse(config.persistence().isPresent());
    assertFalse(config.metricsEnabled());
  }

  @Test
  void fromMapParsesEveryKey() {
    ScribeConfig config = ScribeConfig.fromMap(Map.of(
        "events.historySize", "250",
        "events.debug", "TRUE",
        "state.persistentKeys", "theme, lastProject,",
        "state.loadOnStart", "false",
        "logging.verbose", "true",
        "metrics.enabled", "true"));

    assertEquals(250, config.eventHistorySize());
    assertTrue(config.eventDebug());
    assertEquals(List.of("theme", "lastProject"), config.persistentKeys());
    assertFalse(config.loadOnStart());
    assertTrue(config.verboseLogging());
    assertTrue(config.metricsEnabled());
  }

  @Test
  void blankValuesKeepDefaults() {
    ScribeConfig config = ScribeConfig.fromMap(Map.of("events.historySize", "", "state.persistencePath", " "));

    assertEquals(ScribeConfig.defaults(), config);
  }

  @Test
  void rejectsOutOfRangeHistory() {
    assertThrows(IllegalArgumentException.class,
        () -> ScribeConfig.fromMap(Map.of("state.historySize", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> ScribeConfig.fromMap(Map.of("events.historySize", "lots")));
  }

  @Test
  void rejectsMalformedBooleans() {
    assertThrows(IllegalArgumentException.class,
        () -> ScribeConfig.fromMap(Map.of("events.debug", "yes")));
  }
}
