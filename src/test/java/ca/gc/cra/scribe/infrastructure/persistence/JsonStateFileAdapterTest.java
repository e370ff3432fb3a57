package ca.gc.cra.scribe.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.events.EventBus;
import ca.gc.cra.scribe.application.state.StateManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonStateFileAdapterTest {
  private final JsonStateFileAdapter adapter = new JsonStateFileAdapter();

  @TempDir Path tempDir;

  @Test
  void writesAndReadsSnapshot() throws IOException {
    Path file = tempDir.resolve("config").resolve("state.json");
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("theme", "dark");
    snapshot.put("zoom", 1.5);
    snapshot.put("recent", List.of("a.txt", "b.txt"));
    snapshot.put("window", Map.of("width", 800));
    snapshot.put("maximized", true);
    snapshot.put("lastProject", null);

    adapter.write(file, snapshot);
    Map<String, Object> read = adapter.read(file).orElseThrow();

    assertEquals(snapshot, read);
    assertEquals(List.of("theme", "zoom", "recent", "window", "maximized", "lastProject"),
        List.copyOf(read.keySet()));
  }

  @Test
  void missingFileIsEmpty() throws IOException {
    assertFalse(adapter.read(tempDir.resolve("none.json")).isPresent());
  }

  @Test
  void rewriteLeavesNoTempFiles() throws IOException {
    Path file = tempDir.resolve("state.json");

    adapter.write(file, Map.of("theme", "light"));
    adapter.write(file, Map.of("theme", "dark"));

    assertEquals("dark", adapter.read(file).orElseThrow().get("theme"));
    try (var files = Files.list(tempDir)) {
      assertEquals(List.of(file), files.toList());
    }
  }

  @Test
  void invalidJsonIsAnIoError() throws IOException {
    Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "{\"theme\": ");

    assertThrows(IOException.class, () -> adapter.read(file));
  }

  @Test
  void nonObjectRootIsRejected() throws IOException {
    Path file = tempDir.resolve("array.json");
    Files.writeString(file, "[1, 2]");

    assertThrows(IOException.class, () -> adapter.read(file));
  }

  @Test
  void stateManagerRoundTripsThroughFile() {
    Path file = tempDir.resolve("ui.json");
    EventBus bus = new EventBus();
    StateManager writer = new StateManager(bus, adapter);
    writer.setPersistencePath(file);
    writer.markAsPersistent("theme");
    writer.markAsPersistent("recent");
    writer.set("theme", "dark");
    writer.set("recent", Arrays.asList("a.txt", "b.txt"));
    writer.set("cursor", 42);

    StateManager reader = new StateManager(bus, adapter);
    reader.setPersistencePath(file);

    assertEquals(2, reader.loadPersistentState());
    assertEquals("dark", reader.get("theme"));
    assertEquals(List.of("a.txt", "b.txt"), reader.get("recent"));
    assertTrue(!reader.contains("cursor"));
  }
}
