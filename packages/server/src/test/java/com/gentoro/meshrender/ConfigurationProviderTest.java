package com.gentoro.meshrender;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.meshrender.exception.ConfigException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void bundledDefaultsMatchDocumentedValues() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals(8080, config.getInt("http.port"));
    assertEquals("uploads", config.getString("storage.uploads-dir"));
    assertEquals("output", config.getString("storage.output-dir"));
    assertEquals("file_hashes.json", config.getString("cache.file"));
    assertEquals(100, config.getInt("queue.capacity"));
    assertEquals(600, config.getInt("submission.pending-ttl-seconds"));
    assertEquals(1024, config.getInt("render.width"));
    assertEquals(30.0, config.getDouble("render.fov"), 1e-9);
  }

  @Test
  void readsExplicitFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("app.yaml");
    Files.writeString(file, "http:\n  port: 9090\nqueue:\n  capacity: 5\n");

    Configuration config = new ConfigurationProvider(file.toString()).config();

    assertEquals(9090, config.getInt("http.port"));
    assertEquals(5, config.getInt("queue.capacity"));
  }

  @Test
  void missingFileIsAConfigError(@TempDir Path dir) {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("nope.yaml").toString()));
  }

  @Test
  void invalidYamlIsAConfigError() {
    assertThrows(
        ConfigException.class,
        () -> ConfigurationProvider.read(new StringReader("http:\n  port: [unclosed\n")));
  }
}
