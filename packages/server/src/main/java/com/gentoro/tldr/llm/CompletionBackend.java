package com.gentoro.tldr.llm;

import java.util.List;
import java.util.Optional;

/**
 * Contract of the text-generation backend.
 *
 * <p>Implementations are synchronous and may block for a long time; callers decide on which
 * thread they run.
 */
public interface CompletionBackend {

  /**
   * Run a single turn.
   *
   * @throws com.gentoro.tldr.exception.BackendUnavailableException transport failure
   * @throws com.gentoro.tldr.exception.BackendErrorException non-2xx answer
   * @throws com.gentoro.tldr.exception.EmptyResponseException the turn produced no text
   */
  Completion complete(List<ChatMessage> messages, String model, CompletionOptions options);

  /**
   * Names of installed models.
   *
   * @return the names, or empty when the backend could not be asked
   */
  Optional<List<String>> tryListModels();

  /** Names of installed models. Best effort: never throws, returns an empty list on failure. */
  default List<String> listModels() {
    return tryListModels().orElse(List.of());
  }
}
