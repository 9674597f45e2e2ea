package ca.gc.cra.geosession.config;

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
  void loadMergesCommonAndProfileSections() throws IOException {
    Path yaml = tempDir.resolve("geosession.yaml");
    Files.writeString(yaml, """
        common:
          spark:
            master: "local[1]"
          gdal:
            runtime: jni
        ci:
          gdal:
            runtime: disabled
            unavailable: skip
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "ci").orElseThrow();

    assertEquals("local[1]", map.get("spark.master"));
    assertEquals("disabled", map.get("gdal.runtime"));
    assertEquals("skip", map.get("gdal.unavailable"));
  }

  @Test
  void dottedSparkKeysSurviveFlattening() throws IOException {
    Path yaml = tempDir.resolve("conf.yaml");
    Files.writeString(yaml, """
        common:
          spark:
            conf:
              spark.sql.session.timeZone: UTC
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "test").orElseThrow();
    assertEquals("UTC", map.get("spark.conf.spark.sql.session.timeZone"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "test");
    assertFalse(result.isPresent());
  }

  @Test
  void classpathResourceIsLoaded() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.loadResource(
        getClass().getClassLoader(), HarnessConfig.DEFAULT_RESOURCE, "test");

    assertTrue(result.isPresent());
    assertEquals("recording", result.orElseThrow().get("gdal.runtime"));
  }

  @Test
  void listsAndNonMappingRootsAreRejected() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        common:
          spark:
            master: [local, yarn]
        """);
    Path root = tempDir.resolve("root.yaml");
    Files.writeString(root, """
        - common:
            spark.master: local
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "test"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(root, "test"));
  }
}
