package com.gentoro.tldr.summary;

import com.gentoro.tldr.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/** Default system prompts and the dry-run sample, loaded once from the classpath. */
public final class PromptLibrary {
  static final String DRY_RUN_RESOURCE = "prompts/dry-run.md";

  private final Map<SummaryMode, String> systemPrompts = new EnumMap<>(SummaryMode.class);
  private final String dryRunSample;

  private PromptLibrary(Map<SummaryMode, String> systemPrompts, String dryRunSample) {
    this.systemPrompts.putAll(systemPrompts);
    this.dryRunSample = dryRunSample;
  }

  public static PromptLibrary loadDefaults() {
    Map<SummaryMode, String> prompts = new EnumMap<>(SummaryMode.class);
    for (SummaryMode mode : SummaryMode.values()) {
      prompts.put(mode, read(mode.promptResource()));
    }
    return new PromptLibrary(prompts, read(DRY_RUN_RESOURCE));
  }

  public static PromptLibrary of(Map<SummaryMode, String> systemPrompts, String dryRunSample) {
    return new PromptLibrary(systemPrompts, dryRunSample);
  }

  public String systemPrompt(SummaryMode mode) {
    String prompt = systemPrompts.get(mode);
    if (prompt == null) {
      throw new ConfigException("No system prompt configured for " + mode);
    }
    return prompt;
  }

  public String dryRunSample() {
    return dryRunSample;
  }

  private static String read(String resource) {
    try (InputStream in = PromptLibrary.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Missing bundled resource " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      throw new ConfigException("Could not read bundled resource " + resource, e);
    }
  }
}
