package com.gentoro.tldr.config;

import org.apache.commons.configuration2.Configuration;

/**
 * Transcript source settings.
 *
 * @param baseUrl YouTube origin, overridable for tests
 * @param apiKey public InnerTube key of the web client
 * @param clientVersion web client version reported to the player endpoint
 * @param defaultLanguage caption language used when a request names none
 */
public record YouTubeSettings(
    String baseUrl, String apiKey, String clientVersion, String defaultLanguage) {

  public static YouTubeSettings from(Configuration config) {
    String baseUrl = Settings.nonBlank(config, "transcript.youtube.base-url", "https://www.youtube.com");
    while (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    return new YouTubeSettings(
        baseUrl,
        Settings.nonBlank(config, "transcript.youtube.api-key", null),
        Settings.nonBlank(config, "transcript.youtube.client-version", "2.20250626.01.00"),
        Settings.nonBlank(config, "transcript.default-language", "en"));
  }
}
