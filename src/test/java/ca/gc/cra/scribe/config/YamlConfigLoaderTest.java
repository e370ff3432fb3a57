package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndProfileSections() throws IOException {
    Path yaml = tempDir.resolve("scribe.yaml");
    Files.writeString(yaml, """
        common:
          events:
            historySize: 50
          logging:
            verbose: false
        desktop:
          logging:
            verbose: true
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "Desktop");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("50", map.get("events.historySize"));
    assertEquals("true", map.get("logging.verbose"));
  }

  @Test
  void scalarListsAreJoined() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        common:
          state:
            persistentKeys: [theme, lastProject]
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "desktop").orElseThrow();

    assertEquals("theme,lastProject", map.get("state.persistentKeys"));
  }

  @Test
  void nestedListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          registry:
            discoveryPaths:
              - path: plugins
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "desktop"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "desktop").isPresent());
    assertEquals(ScribeConfig.defaults(),
        YamlConfigLoader.loadConfig(tempDir.resolve("missing.yaml"), "desktop"));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - desktop:
            events: {}
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "desktop"));
  }

  @Test
  void loadConfigBuildsValidatedConfig() throws IOException {
    Path yaml = tempDir.resolve("full.yaml");
    Files.writeString(yaml, """
        common:
          state:
            historySize: 20
            persistencePath: prefs/ui.json
            persistentKeys:
              - theme
          registry:
            discoveryPaths: plugins, extensions
        """);

    ScribeConfig config = YamlConfigLoader.loadConfig(yaml, "desktop");

    assertEquals(20, config.stateHistorySize());
    assertEquals(Path.of("prefs/ui.json"), config.persistencePath());
    assertEquals(List.of("theme"), config.persistentKeys());
    assertEquals(List.of(Path.of("plugins"), Path.of("extensions")), config.discoveryPaths());
  }
}
