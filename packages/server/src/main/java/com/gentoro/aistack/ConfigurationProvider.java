package com.gentoro.aistack;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML documents (the application configuration and stack manifests) as Apache Commons
 * Configuration instances.
 *
 * <p>Location formats supported: {@code classpath:some/path.yaml}, {@code file:/abs/path.yaml} and
 * plain filesystem paths, absolute or relative. Values may reference {@code ${env:VAR}}; variables
 * missing from the environment are looked up in a {@code .env.local} file.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private final YAMLConfiguration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYaml(location);
  }

  public Configuration config() {
    return configuration;
  }

  /** Load a YAML document from a location string. */
  public static YAMLConfiguration loadYaml(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml", false);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()), true);
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid file location: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  /** Parse YAML text; used for manifests supplied inline. */
  public static YAMLConfiguration parseYaml(String yamlContent) {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(new StringReader(yamlContent));
    } catch (ConfigurationException e) {
      throw new SerializationException("Failed to parse YAML content", e);
    }
    return addOns(config);
  }

  private static YAMLConfiguration loadYamlFromClasspath(String resourceName, boolean required) {
    String name = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream input = cl.getResourceAsStream(name)) {
      if (input == null) {
        if (required) {
          throw new ConfigException(
              "Classpath resource not found: " + name,
              new FileNotFoundException("Resource not found: %s".formatted(name)));
        }
        // Allows running on defaults when no application.yaml is packaged.
        return addOns(new YAMLConfiguration());
      }
      log.info("Loading configuration from classpath resource: {}", name);
      return parseYaml(new String(input.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SerializationException("Failed to read YAML from classpath resource: " + name, e);
    }
  }

  private static YAMLConfiguration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static YAMLConfiguration addOns(YAMLConfiguration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback = null;

    @Override
    public Object lookup(String expression) {
      // ${env:NAME:-default}
      int sep = expression.indexOf(":-");
      String key = sep < 0 ? expression : expression.substring(0, sep);
      String defaultValue = sep < 0 ? null : expression.substring(sep + 2);
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = findEnvFile();
            this.fallback = path == null ? new HashMap<>() : readKeyValueFile(path);
          }
        }
      }
      String fromFile = fallback.get(key);
      return fromFile != null ? fromFile : defaultValue;
    }

    private Path findEnvFile() {
      for (Path candidate :
          new Path[] {Paths.get(".env.local"), Paths.get("packages/server/.env.local")}) {
        if (Files.exists(candidate)) {
          return candidate;
        }
      }
      log.debug("No .env.local found, environment lookups use the process environment only");
      return null;
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(this::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        log.warn("Could not read {}, ignoring it", path.toAbsolutePath(), e);
        return Collections.emptyMap();
      }
    }

    private Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      String val = line.substring(idx + 1).trim();
      if ((val.startsWith("\"") && val.endsWith("\"") && val.length() > 1)
          || (val.startsWith("'") && val.endsWith("'") && val.length() > 1)) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
