package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.component.ComponentRegistry;
import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.ErrorReporter;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.application.port.StatePersistencePort;
import ca.gc.cra.scribe.application.state.StateManager;
import ca.gc.cra.scribe.infrastructure.errors.LoggingErrorReporter;
import ca.gc.cra.scribe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.scribe.infrastructure.persistence.JsonStateFileAdapter;
import ca.gc.cra.scribe.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.scribe.logging.LoggingConfigurator;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the SCRIBE core services to concrete
 * adapters.
 * <p><strong>Why:</strong> Provides one place to translate {@link ScribeConfig} into a ready event bus,
 * state manager and component registry.</p>
 * <p><strong>Role:</strong> Adapter composition root; the host application builds one at start-up and
 * hands its services to the UI layer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter and clock.</li>
 *   <li>Apply persistence settings and load persisted state.</li>
 *   <li>Register discovery paths on the component registry.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build and use on the UI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String METER_NAME = "scribe";

  private final ScribeConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final EventBus eventBus;
  private final StateManager stateManager;
  private final ErrorReporter errorReporter;
  private final ComponentRegistry registry;

  /**
   * Wires services from {@code config}, using the global OpenTelemetry meter when metrics are enabled.
   */
  public CompositionRoot(ScribeConfig config) {
    this(config, defaultMetrics(config), new JsonStateFileAdapter(), new SystemClockAdapter());
  }

  /**
   * Wires services from {@code config} with caller-supplied adapters.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every service
   * @param persistence snapshot store for persistent state
   * @param clock time source for histories and lifecycle timestamps
   */
  public CompositionRoot(
      ScribeConfig config, MetricsPort metrics, StatePersistencePort persistence, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(persistence, "persistence");

    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    this.eventBus = new EventBus(config.eventHistorySize(), metrics);
    eventBus.setDebugMode(config.eventDebug());

    this.stateManager =
        new StateManager(eventBus, persistence, clock, metrics, config.stateHistorySize());
    config.persistence().ifPresent(stateManager::setPersistencePath);
    for (String key : config.persistentKeys()) {
      stateManager.markAsPersistent(key);
    }
    if (config.loadOnStart() && config.persistence().isPresent()) {
      int loaded = stateManager.loadPersistentState();
      log.info("Loaded {} persistent state keys from {}", loaded, config.persistencePath());
    }

    this.errorReporter = new LoggingErrorReporter(eventBus);
    this.registry = new ComponentRegistry(eventBus, stateManager, errorReporter, clock, metrics);
    for (Path path : config.discoveryPaths()) {
      registry.addDiscoveryPath(path);
    }
    log.debug("SCRIBE services wired (metrics {})", config.metricsEnabled() ? "enabled" : "disabled");
  }

  private static MetricsPort defaultMetrics(ScribeConfig config) {
    if (config.metricsEnabled()) {
      return new OpenTelemetryMetricsAdapter(GlobalOpenTelemetry.getMeter(METER_NAME));
    }
    return MetricsPort.NO_OP;
  }

  public ScribeConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public StateManager stateManager() {
    return stateManager;
  }

  public ErrorReporter errorReporter() {
    return errorReporter;
  }

  public ComponentRegistry registry() {
    return registry;
  }

  /**
   * Disposes every component and drops registry contents. Persistent state is already on disk.
   */
  public void shutdown() {
    registry.clear();
    log.info("SCRIBE services shut down");
  }
}
