package com.gentoro.tldr.config;

import com.gentoro.tldr.llm.CompletionOptions;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Connection settings for the Ollama completion backend.
 *
 * @param baseUrl e.g. {@code http://127.0.0.1:11434}, without a trailing slash
 * @param callTimeout per chat call, {@link Duration#ZERO} means unbounded
 * @param listTimeout timeout for the model listing endpoint
 * @param defaultModel model used when a request names none
 * @param options generation tunables sent with every turn
 */
public record OllamaSettings(
    String baseUrl,
    Duration callTimeout,
    Duration listTimeout,
    String defaultModel,
    CompletionOptions options) {

  public static OllamaSettings from(Configuration config) {
    String baseUrl = Settings.nonBlank(config, "llm.ollama.base-url", "http://127.0.0.1:11434");
    while (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    CompletionOptions options =
        new CompletionOptions(
            Settings.nonNegativeDouble(config, "llm.options.temperature", 0.2),
            Settings.nonNegativeDouble(config, "llm.options.repeat-penalty", 1.1),
            Settings.positiveInt(config, "llm.options.num-ctx", 8192),
            Settings.positiveInt(config, "llm.options.num-predict", 2048),
            Settings.nonNegativeInt(config, "llm.options.max-continuations", 3));
    return new OllamaSettings(
        baseUrl,
        Duration.ofSeconds(Settings.nonNegativeLong(config, "llm.ollama.timeout-seconds", 0)),
        Duration.ofSeconds(Settings.positiveLong(config, "llm.ollama.list-timeout-seconds", 5)),
        Settings.nonBlank(config, "llm.default-model", "gpt-oss:20b"),
        options);
  }
}
