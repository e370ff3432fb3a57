package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.validation.Numbers;
import ca.gc.cra.scribe.validation.Strings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable start-up configuration for the SCRIBE core services.
 * <p><strong>Why:</strong> Collects history capacities, persistence settings and discovery paths in one
 * validated value before {@link CompositionRoot} wires anything.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param eventHistorySize number of events retained by the bus
 * @param eventDebug whether the bus logs every emitted event
 * @param stateHistorySize number of undoable state changes retained
 * @param persistencePath snapshot file, or {@code null} when persistence is disabled
 * @param persistentKeys state keys written to the snapshot
 * @param loadOnStart whether persistent state is loaded when the root is built
 * @param discoveryPaths class-path roots scanned for annotated components
 * @param verboseLogging whether the root logger is raised to DEBUG
 * @param metricsEnabled whether counters go to the global OpenTelemetry meter
 * @since 0.1.0
 */
public record ScribeConfig(
    int eventHistorySize,
    boolean eventDebug,
    int stateHistorySize,
    Path persistencePath,
    List<String> persistentKeys,
    boolean loadOnStart,
    List<Path> discoveryPaths,
    boolean verboseLogging,
    boolean metricsEnabled) {

  static final int DEFAULT_HISTORY_SIZE = 100;
  static final int MAX_HISTORY_SIZE = 100_000;

  public ScribeConfig {
    Numbers.requireRange("events.historySize", eventHistorySize, 1, MAX_HISTORY_SIZE);
    Numbers.requireRange("state.historySize", stateHistorySize, 1, MAX_HISTORY_SIZE);
    persistentKeys = persistentKeys == null ? List.of() : List.copyOf(persistentKeys);
    discoveryPaths = discoveryPaths == null ? List.of() : List.copyOf(discoveryPaths);
  }

  /**
   * Returns the configuration used when no file or overrides are supplied.
   */
  public static ScribeConfig defaults() {
    return new ScribeConfig(
        DEFAULT_HISTORY_SIZE, false, DEFAULT_HISTORY_SIZE, null, List.of(), true, List.of(), false, false);
  }

  /**
   * Builds a configuration from flat dotted keys, as produced by {@link YamlConfigLoader}. Missing keys
   * keep their defaults; unknown keys are ignored.
   *
   * @param values flat key/value pairs; never {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ScribeConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ScribeConfig defaults = defaults();
    int eventHistory = intValue(values, "events.historySize", defaults.eventHistorySize());
    boolean eventDebug = booleanValue(values, "events.debug", defaults.eventDebug());
    int stateHistory = intValue(values, "state.historySize", defaults.stateHistorySize());
    Path persistencePath = Optional.ofNullable(values.get("state.persistencePath"))
        .filter(raw -> !raw.isBlank())
        .map(raw -> Path.of(Strings.requireNonBlank("state.persistencePath", raw)))
        .orElse(null);
    List<String> persistentKeys = Strings.splitCsv("state.persistentKeys", values.get("state.persistentKeys"));
    boolean loadOnStart = booleanValue(values, "state.loadOnStart", defaults.loadOnStart());
    List<Path> discoveryPaths = new ArrayList<>();
    for (String raw : Strings.splitCsv("registry.discoveryPaths", values.get("registry.discoveryPaths"))) {
      discoveryPaths.add(Path.of(raw));
    }
    boolean verbose = booleanValue(values, "logging.verbose", defaults.verboseLogging());
    boolean metrics = booleanValue(values, "metrics.enabled", defaults.metricsEnabled());
    return new ScribeConfig(
        eventHistory, eventDebug, stateHistory, persistencePath, persistentKeys, loadOnStart,
        discoveryPaths, verbose, metrics);
  }

  public Optional<Path> persistence() {
    return Optional.ofNullable(persistencePath);
  }

  private static int intValue(Map<String, String> values, String key, int fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(key, raw, 1, MAX_HISTORY_SIZE);
  }

  private static boolean booleanValue(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
  }
}
