package com.gentoro.tldr.summary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code /api/summarize} and {@code /api/submit*}.
 *
 * <p>{@code api_key} is accepted for compatibility with older clients and ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SummaryRequest(
    @JsonProperty("url") String url,
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("model") String model,
    @JsonProperty("system_prompt") String systemPrompt,
    @JsonProperty("language") String language,
    @JsonProperty("dry_run") boolean dryRun,
    @JsonProperty("transcript_only") boolean transcriptOnly) {

  public static SummaryRequest of(String url) {
    return new SummaryRequest(url, null, null, null, null, false, false);
  }
}
