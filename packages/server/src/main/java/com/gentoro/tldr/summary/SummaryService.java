package com.gentoro.tldr.summary;

import com.gentoro.tldr.exception.BadRequestException;
import com.gentoro.tldr.exception.LlmException;
import com.gentoro.tldr.exception.TranscriptException;
import com.gentoro.tldr.llm.CompletionAccumulator;
import com.gentoro.tldr.logging.LoggingService;
import com.gentoro.tldr.transcript.Transcript;
import com.gentoro.tldr.transcript.TranscriptSource;
import org.slf4j.Logger;

/**
 * Turns a {@link SummaryRequest} into a {@link SummaryResult} by chaining the transcript source and
 * the completion accumulator. Runs entirely on the calling thread.
 */
public class SummaryService {
  private static final Logger log = LoggingService.getLogger(SummaryService.class);
  static final String DRY_RUN_NAME = "Dry Run";

  private final TranscriptSource transcripts;
  private final CompletionAccumulator accumulator;
  private final PromptLibrary prompts;
  private final String defaultModel;
  private final String defaultLanguage;

  public SummaryService(
      TranscriptSource transcripts,
      CompletionAccumulator accumulator,
      PromptLibrary prompts,
      String defaultModel,
      String defaultLanguage) {
    this.transcripts = transcripts;
    this.accumulator = accumulator;
    this.prompts = prompts;
    this.defaultModel = defaultModel;
    this.defaultLanguage = defaultLanguage;
  }

  public SummaryResult summarize(SummaryRequest request) {
    return run(request, SummaryMode.SUMMARY);
  }

  public SummaryResult script(SummaryRequest request) {
    return run(request, SummaryMode.SCRIPT);
  }

  public SummaryResult run(SummaryRequest request, SummaryMode mode) {
    if (request == null) {
      throw new BadRequestException("Request body is required");
    }
    if (request.dryRun()) {
      String sample = prompts.dryRunSample();
      return new SummaryResult(sample, sample, DRY_RUN_NAME);
    }
    if (isBlank(request.url())) {
      throw new BadRequestException("Field 'url' is required");
    }

    String language = isBlank(request.language()) ? defaultLanguage : request.language().trim();
    Transcript transcript;
    try {
      transcript = transcripts.fetch(request.url().trim(), language);
    } catch (TranscriptException e) {
      throw new TranscriptException(e.kind(), "Transcript error: " + e.getMessage(), e);
    }

    if (request.transcriptOnly()) {
      return new SummaryResult(transcript.text(), transcript.text(), transcript.title());
    }

    String model = isBlank(request.model()) ? defaultModel : request.model().trim();
    String systemPrompt =
        isBlank(request.systemPrompt()) ? prompts.systemPrompt(mode) : request.systemPrompt();
    log.info(
        "Generating {} for '{}' with model {} ({} transcript chars)",
        mode.name().toLowerCase(),
        transcript.title(),
        model,
        transcript.text().length());

    String generated;
    try {
      generated = accumulator.generate(systemPrompt, transcript.text(), model);
    } catch (LlmException e) {
      throw new LlmException("Ollama error: " + e.getMessage(), e);
    }
    return new SummaryResult(generated, transcript.text(), transcript.title());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
