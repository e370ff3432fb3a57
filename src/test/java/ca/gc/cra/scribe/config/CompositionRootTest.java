package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.component.ComponentDescriptor;
import ca.gc.cra.scribe.application.component.ResolvedDependencies;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.component.ComponentType;
import ca.gc.cra.scribe.infrastructure.persistence.JsonStateFileAdapter;
import ca.gc.cra.scribe.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.scribe.testutil.RecordingMetricsPort;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  @Test
  void wiresServicesFromConfig() {
    Path snapshot = tempDir.resolve("ui.json");
    ScribeConfig config = ScribeConfig.fromMap(Map.of(
        "events.historySize", "10",
        "events.debug", "true",
        "state.persistencePath", snapshot.toString(),
        "state.persistentKeys", "theme",
        "registry.discoveryPaths", tempDir.toString()));
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    CompositionRoot root = new CompositionRoot(config, metrics, new JsonStateFileAdapter(), new SystemClockAdapter());

    assertEquals(10, root.eventBus().maxHistorySize());
    assertTrue(root.eventBus().isDebugMode());
    assertEquals(snapshot, root.stateManager().persistencePath().orElseThrow());
    assertEquals(List.of(tempDir), root.registry().getDiscoveryPaths());

    root.stateManager().set("theme", "dark");
    assertTrue(java.nio.file.Files.exists(snapshot));
    assertEquals(1, metrics.count("state.changes"));
  }

  @Test
  void persistedStateIsLoadedOnStart() {
    Path snapshot = tempDir.resolve("ui.json");
    Map<String, String> values = Map.of(
        "state.persistencePath", snapshot.toString(),
        "state.persistentKeys", "theme");
    CompositionRoot first = new CompositionRoot(ScribeConfig.fromMap(values));
    first.stateManager().set("theme", "dark");

    CompositionRoot second = new CompositionRoot(ScribeConfig.fromMap(values));

    assertEquals("dark", second.stateManager().get("theme"));
  }

  @Test
  void componentsReceiveTheSharedServices() {
    CompositionRoot root = new CompositionRoot(ScribeConfig.defaults());
    root.registry().register(ComponentDescriptor.builder(Probe.class, ComponentType.UTILITY).id("probe").build());

    Probe probe = (Probe) root.registry().createInstance("probe");

    assertSame(root.eventBus(), probe.dependencies.eventBus());
    assertSame(root.errorReporter(), probe.dependencies.errorReporter());
    assertSame(MetricsPort.NO_OP, root.metrics());
    root.shutdown();
    assertTrue(root.registry().getAllComponents().isEmpty());
  }

  public static final class Probe {
    final ResolvedDependencies dependencies;

    public Probe(ResolvedDependencies dependencies) {
      this.dependencies = dependencies;
    }
  }
}
