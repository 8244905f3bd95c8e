package com.gentoro.meshrender;

import com.gentoro.meshrender.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads {@code application.yaml}, either from an explicit file or from the classpath.
 *
 * <p>Values of the form {@code ${env:NAME}} are resolved by Commons Configuration interpolation.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String configFile) {
    this.config = configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(configFile);
  }

  public Configuration config() {
    return config;
  }

  private static Configuration loadFile(String configFile) {
    Path path = Paths.get(configFile);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration file: " + path, e);
    }
  }

  private static Configuration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new ConfigException("Missing classpath resource: " + resource);
    }
    log.debug("Loading configuration from classpath:{}", resource);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Failed to read classpath resource: " + resource, e);
    }
  }

  static Configuration read(Reader reader) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration", e);
    }
    return yaml;
  }
}
