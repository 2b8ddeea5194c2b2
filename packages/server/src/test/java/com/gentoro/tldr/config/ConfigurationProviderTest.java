package com.gentoro.tldr.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tldr.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("Bundled defaults produce the documented settings")
  void bundledDefaults() {
    Configuration config = new ConfigurationProvider(null, Map.of()).config();

    ServerSettings server = ServerSettings.from(config);
    assertEquals("0.0.0.0", server.hostname());
    assertEquals(8001, server.port());
    assertEquals(4, server.workers());
    assertEquals(100, server.queueCapacity());
    assertEquals(8 * 1024, server.maxHeaderBytes());
    assertEquals(10 * 1024 * 1024, server.maxBodyBytes());
    assertEquals(Duration.ofSeconds(15), server.readTimeout());
    assertEquals(Duration.ofSeconds(15), server.writeTimeout());

    OllamaSettings ollama = OllamaSettings.from(config);
    assertEquals("http://127.0.0.1:11434", ollama.baseUrl());
    assertEquals("gpt-oss:20b", ollama.defaultModel());
    assertEquals(Duration.ZERO, ollama.callTimeout());
    assertEquals(8192, ollama.options().contextSize());
    assertEquals(2048, ollama.options().maxTokensPerTurn());
    assertEquals(3, ollama.options().maxContinuations());
    assertEquals(0.2, ollama.options().temperature(), 1e-9);

    JobSettings jobs = JobSettings.from(config);
    assertEquals(Duration.ofMinutes(60), jobs.retention());

    YouTubeSettings youTube = YouTubeSettings.from(config);
    assertEquals("en", youTube.defaultLanguage());
    assertEquals("2.20250626.01.00", youTube.clientVersion());
  }

  @Test
  @DisplayName("Environment variables win over file and bundled values")
  void environmentOverrides() throws Exception {
    Path external = tempDir.resolve("override.yaml");
    Files.writeString(external, "http:\n  port: 9100\n  workers: 8\nllm:\n  default-model: from-file\n");

    Configuration config =
        new ConfigurationProvider(
                external,
                Map.of(
                    "TLDR_PORT", "9200",
                    "OLLAMA_BASE_URL", "http://ollama:11434/",
                    "OLLAMA_TIMEOUT_SECS", "120",
                    "TLDR_IO_TIMEOUT_SECS", "30"))
            .config();

    ServerSettings server = ServerSettings.from(config);
    assertEquals(9200, server.port());
    assertEquals(8, server.workers());
    assertEquals(Duration.ofSeconds(30), server.readTimeout());

    OllamaSettings ollama = OllamaSettings.from(config);
    assertEquals("http://ollama:11434", ollama.baseUrl());
    assertEquals("from-file", ollama.defaultModel());
    assertEquals(Duration.ofSeconds(120), ollama.callTimeout());
  }

  @Test
  @DisplayName("A missing external file fails startup")
  void missingExternalFile() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tempDir.resolve("absent.yaml"), Map.of()));
  }

  @Test
  @DisplayName("Invalid values are reported as configuration errors")
  void invalidValues() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("http.workers", "0");
    assertThrows(ConfigException.class, () -> ServerSettings.from(config));

    BaseConfiguration unparsable = new BaseConfiguration();
    unparsable.setProperty("http.port", "eighty");
    assertThrows(ConfigException.class, () -> ServerSettings.from(unparsable));

    BaseConfiguration outOfRange = new BaseConfiguration();
    outOfRange.setProperty("http.port", "70000");
    assertThrows(ConfigException.class, () -> ServerSettings.from(outOfRange));
  }
}
