package com.gentoro.tldr.config;

import com.gentoro.tldr.exception.ConfigException;
import com.gentoro.tldr.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the application configuration.
 *
 * <p>Resolution order, later sources win:
 *
 * <ol>
 *   <li>the bundled {@code application.yaml} on the classpath
 *   <li>an optional external YAML file
 *   <li>environment variables listed in {@link #ENV_OVERRIDES}
 * </ol>
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  /** Environment variable name to configuration key. */
  public static final Map<String, String> ENV_OVERRIDES;

  static {
    Map<String, String> env = new LinkedHashMap<>();
    env.put("TLDR_IP", "http.hostname");
    env.put("TLDR_PORT", "http.port");
    env.put("TLDR_WORKERS", "http.workers");
    env.put("TLDR_QUEUE_CAPACITY", "http.queue-capacity");
    env.put("TLDR_MAX_HEADER_BYTES", "http.max-header-bytes");
    env.put("TLDR_MAX_BODY_BYTES", "http.max-body-bytes");
    env.put("TLDR_IO_TIMEOUT_SECS", "http.io-timeout-seconds");
    env.put("TLDR_JOB_WORKERS", "jobs.workers");
    env.put("TLDR_JOB_QUEUE_CAPACITY", "jobs.queue-capacity");
    env.put("TLDR_JOB_RETENTION_MINUTES", "jobs.retention-minutes");
    env.put("OLLAMA_BASE_URL", "llm.ollama.base-url");
    env.put("OLLAMA_TIMEOUT_SECS", "llm.ollama.timeout-seconds");
    env.put("OLLAMA_MODEL", "llm.default-model");
    env.put("OLLAMA_NUM_CTX", "llm.options.num-ctx");
    env.put("OLLAMA_NUM_PREDICT", "llm.options.num-predict");
    env.put("OLLAMA_TEMPERATURE", "llm.options.temperature");
    env.put("OLLAMA_REPEAT_PENALTY", "llm.options.repeat-penalty");
    env.put("OLLAMA_MAX_CONTINUATIONS", "llm.options.max-continuations");
    ENV_OVERRIDES = Map.copyOf(env);
  }

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path externalFile) {
    this(externalFile, System.getenv());
  }

  public ConfigurationProvider(Path externalFile, Map<String, String> environment) {
    this.config = loadBundled();
    if (externalFile != null) {
      overlay(externalFile);
    }
    applyEnvironment(Objects.requireNonNullElse(environment, Map.of()));
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadBundled() {
    YAMLConfiguration yaml = new YAMLConfiguration();
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new ConfigException("Bundled configuration '%s' not found".formatted(DEFAULT_RESOURCE));
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (ConfigurationException | IOException e) {
      throw new ConfigException("Failed to parse bundled configuration", e);
    }
    return yaml;
  }

  private void overlay(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file);
    }
    YAMLConfiguration external = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      external.read(reader);
    } catch (ConfigurationException | IOException e) {
      throw new ConfigException("Failed to parse configuration file " + file, e);
    }
    log.info("Applying configuration overrides from {}", file.toAbsolutePath());
    config.copy(external);
  }

  private void applyEnvironment(Map<String, String> environment) {
    ENV_OVERRIDES.forEach(
        (variable, key) -> {
          String value = environment.get(variable);
          if (value != null && !value.isBlank()) {
            log.debug("Environment override {} -> {}", variable, key);
            config.setProperty(key, value.trim());
          }
        });
  }
}
