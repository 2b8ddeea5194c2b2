package com.gentoro.tldr.llm;

import com.gentoro.tldr.exception.BackendErrorException;
import com.gentoro.tldr.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Drives one or more turns against a {@link CompletionBackend} and concatenates their output.
 *
 * <p>The conversation is seeded with the system instruction and the user content. Whenever a turn
 * reports truncation and the continuation budget is not yet spent, the partial answer and a fixed
 * continuation instruction are appended and another turn is requested. Every turn's text is kept,
 * including the last one even if it was truncated, so at most {@code maxContinuations + 1} backend
 * calls are made.
 */
public class CompletionAccumulator {
  private static final Logger log = LoggingService.getLogger(CompletionAccumulator.class);

  static final String CONTINUATION_PROMPT =
      "Continue exactly where you stopped. Finish any unfinished sections and keep the same"
          + " Markdown formatting. Do not repeat what you already wrote.";

  private final CompletionBackend backend;
  private final CompletionOptions options;

  public CompletionAccumulator(CompletionBackend backend, CompletionOptions options) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Generate text for the given instruction and content.
   *
   * @throws com.gentoro.tldr.exception.LlmException when any turn fails
   */
  public String generate(String systemInstruction, String userContent, String model) {
    List<ChatMessage> conversation = new ArrayList<>();
    conversation.add(ChatMessage.system(systemInstruction));
    conversation.add(ChatMessage.user(userContent));

    StringBuilder accumulated = new StringBuilder();
    int turns = 0;
    while (true) {
      Completion completion = runTurn(conversation, model);
      turns++;
      accumulated.append(completion.text());
      log.debug(
          "Turn {} on model {} produced {} chars (truncated: {})",
          turns,
          model,
          completion.text().length(),
          completion.truncated());

      if (!completion.truncated() || turns > options.maxContinuations()) {
        if (completion.truncated()) {
          log.info(
              "Continuation budget of {} exhausted for model {}, returning partial output",
              options.maxContinuations(),
              model);
        }
        return accumulated.toString();
      }
      conversation.add(ChatMessage.assistant(completion.text()));
      conversation.add(ChatMessage.user(CONTINUATION_PROMPT));
    }
  }

  private Completion runTurn(List<ChatMessage> conversation, String model) {
    try {
      return backend.complete(List.copyOf(conversation), model, options);
    } catch (BackendErrorException e) {
      if (e.suggestsMissingModel()) {
        throw missingModel(e, model);
      }
      throw e;
    }
  }

  private BackendErrorException missingModel(BackendErrorException original, String model) {
    Optional<List<String>> lookup;
    try {
      lookup = backend.tryListModels();
    } catch (RuntimeException listingFailure) {
      log.debug("Could not list models while reporting a missing model", listingFailure);
      return original;
    }
    if (lookup == null || lookup.isEmpty()) {
      log.debug("Model listing unavailable, keeping the backend's own error for model {}", model);
      return original;
    }
    List<String> installed = lookup.get();
    String suggestion =
        installed.isEmpty()
            ? "No local models found. Pull one, e.g.: ollama pull llama3:8b"
            : "Installed models: " + String.join(", ", installed);
    return new BackendErrorException(
        original.status(),
        original.body(),
        "Model '%s' not found. Pull it with: ollama pull %s. %s".formatted(model, model, suggestion));
  }
}
