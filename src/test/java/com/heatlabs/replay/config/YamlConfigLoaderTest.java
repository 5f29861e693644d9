package com.heatlabs.replay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("replay.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        scan:
          in: ./replays
          workers: 4
        report:
          format: json
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "scan");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("./replays", map.get("in"));
    assertEquals("4", map.get("workers"));
    assertFalse(map.containsKey("format"));
  }

  @Test
  void modeSectionOverridesCommonAndMatchesCaseInsensitively() throws IOException {
    Path yaml = tempDir.resolve("replay.yaml");
    Files.writeString(yaml, """
        common:
          corpus: shared.json
        Report:
          corpus: report.json
          analyzer:
            extra: 1
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "REPORT").orElseThrow();

    assertEquals("report.json", map.get("corpus"));
    assertEquals("1", map.get("analyzer.extra"));
  }

  @Test
  void nullValuesBecomeEmptyStrings() throws IOException {
    Path yaml = tempDir.resolve("replay.yaml");
    Files.writeString(yaml, """
        report:
          out:
        """);

    assertEquals("", YamlConfigLoader.load(yaml, "report").orElseThrow().get("out"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "scan").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "scan"));
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        - scan:
            in: ./replays
        """);
    Path scalarSection = tempDir.resolve("scalar.yaml");
    Files.writeString(scalarSection, "scan: 5\n");
    Path arrays = tempDir.resolve("arrays.yaml");
    Files.writeString(arrays, """
        scan:
          in: [a, b]
        """);
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "scan: {in: ./replays\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "scan"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarSection, "scan"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "scan"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "scan"));
  }
}
