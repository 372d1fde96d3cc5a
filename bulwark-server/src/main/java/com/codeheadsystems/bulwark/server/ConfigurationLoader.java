package com.codeheadsystems.bulwark.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link BulwarkConfiguration} from YAML. Unknown keys are ignored and missing keys keep
 * their defaults.
 */
public class ConfigurationLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper mapper;

  /**
   * Instantiates a new Configuration loader.
   */
  public ConfigurationLoader() {
    this.mapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Loads a configuration file.
   *
   * @param path the path
   * @return the configuration
   * @throws ConfigurationException if the file cannot be read or bound
   */
  public BulwarkConfiguration load(Path path) {
    log.info("Loading configuration from {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read configuration " + path, e);
    }
  }

  /**
   * Loads a configuration from a class path resource.
   *
   * @param resource the resource name
   * @return the configuration
   * @throws ConfigurationException if the resource is missing or cannot be bound
   */
  public BulwarkConfiguration loadResource(String resource) {
    InputStream in = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new ConfigurationException("Configuration resource not found: " + resource, null);
    }
    try (in) {
      return load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read configuration resource " + resource, e);
    }
  }

  /**
   * Binds a YAML stream. An empty stream yields the defaults.
   *
   * @param in the stream, left open
   * @return the configuration
   * @throws ConfigurationException if the content cannot be bound
   */
  public BulwarkConfiguration load(InputStream in) {
    try {
      byte[] content = in.readAllBytes();
      if (content.length == 0) {
        return new BulwarkConfiguration();
      }
      BulwarkConfiguration configuration = mapper.readValue(content, BulwarkConfiguration.class);
      return configuration == null ? new BulwarkConfiguration() : configuration;
    } catch (IOException e) {
      throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
    }
  }
}
