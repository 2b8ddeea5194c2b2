package com.gentoro.tldr.llm;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.tldr.exception.BackendErrorException;
import com.gentoro.tldr.exception.BackendUnavailableException;
import com.gentoro.tldr.exception.EmptyResponseException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompletionAccumulatorTest {

  private static final CompletionOptions OPTIONS = new CompletionOptions(0.2, 1.1, 8192, 2048, 3);

  @Mock private CompletionBackend backend;
  private CompletionAccumulator accumulator;

  @BeforeEach
  void setUp() {
    accumulator = new CompletionAccumulator(backend, OPTIONS);
  }

  @Test
  @DisplayName("A complete first turn is returned as is after one call")
  void singleTurn() {
    when(backend.complete(anyList(), eq("m"), eq(OPTIONS))).thenReturn(new Completion("all", false));

    assertEquals("all", accumulator.generate("sys", "user", "m"));
    verify(backend, times(1)).complete(anyList(), anyString(), any());
  }

  @Test
  @DisplayName("Truncated then complete yields both texts after exactly two calls")
  @SuppressWarnings("unchecked")
  void continuesOnce() {
    when(backend.complete(anyList(), anyString(), any()))
        .thenReturn(new Completion("first ", true), new Completion("second", false));

    assertEquals("first second", accumulator.generate("sys", "user", "m"));

    ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
    verify(backend, times(2)).complete(captor.capture(), eq("m"), eq(OPTIONS));
    List<ChatMessage> secondTurn = captor.getAllValues().get(1);
    assertEquals(4, secondTurn.size());
    assertEquals(ChatMessage.system("sys"), secondTurn.get(0));
    assertEquals(ChatMessage.user("user"), secondTurn.get(1));
    assertEquals(ChatMessage.assistant("first "), secondTurn.get(2));
    assertEquals(
        ChatMessage.user(CompletionAccumulator.CONTINUATION_PROMPT), secondTurn.get(3));
  }

  @Test
  @DisplayName("Always truncated stops after budget + 1 calls and keeps every turn")
  void budgetExhausted() {
    when(backend.complete(anyList(), anyString(), any()))
        .thenReturn(
            new Completion("a", true),
            new Completion("b", true),
            new Completion("c", true),
            new Completion("d", true),
            new Completion("never", true));

    assertEquals("abcd", accumulator.generate("sys", "user", "m"));
    verify(backend, times(OPTIONS.maxContinuations() + 1)).complete(anyList(), anyString(), any());
  }

  @Test
  @DisplayName("A zero budget makes a single call even when truncated")
  void zeroBudget() {
    CompletionOptions none = new CompletionOptions(0.2, 1.1, 8192, 2048, 0);
    when(backend.complete(anyList(), anyString(), any())).thenReturn(new Completion("part", true));

    assertEquals("part", new CompletionAccumulator(backend, none).generate("s", "u", "m"));
    verify(backend, times(1)).complete(anyList(), anyString(), any());
  }

  @Test
  @DisplayName("Missing model errors are enriched with the installed models")
  void missingModelEnriched() {
    when(backend.complete(anyList(), anyString(), any()))
        .thenThrow(new BackendErrorException(404, "{\"error\":\"model 'x' not found\"}"));
    when(backend.tryListModels()).thenReturn(Optional.of(List.of("llama3:8b", "qwen2:7b")));

    BackendErrorException e =
        assertThrows(BackendErrorException.class, () -> accumulator.generate("s", "u", "x"));
    assertEquals(404, e.status());
    assertTrue(e.getMessage().startsWith("Model 'x' not found. Pull it with: ollama pull x."));
    assertTrue(e.getMessage().contains("Installed models: llama3:8b, qwen2:7b"));
  }

  @Test
  @DisplayName("Enrichment suggests pulling a model when none is installed")
  void missingModelNoneInstalled() {
    when(backend.complete(anyList(), anyString(), any()))
        .thenThrow(new BackendErrorException(404, "not found"));
    when(backend.tryListModels()).thenReturn(Optional.of(List.of()));

    BackendErrorException e =
        assertThrows(BackendErrorException.class, () -> accumulator.generate("s", "u", "x"));
    assertTrue(e.getMessage().contains("No local models found"));
  }

  @Test
  @DisplayName("A failing model listing leaves the original error untouched")
  void enrichmentFailureSwallowed() {
    BackendErrorException original = new BackendErrorException(404, "not found");
    when(backend.complete(anyList(), anyString(), any())).thenThrow(original);
    when(backend.tryListModels()).thenReturn(Optional.empty());

    assertSame(
        original,
        assertThrows(BackendErrorException.class, () -> accumulator.generate("s", "u", "x")));
  }

  @Test
  @DisplayName("Other backend errors are not enriched")
  void otherErrorsPassThrough() {
    when(backend.complete(anyList(), anyString(), any()))
        .thenThrow(new BackendErrorException(500, "out of memory"));

    BackendErrorException e =
        assertThrows(BackendErrorException.class, () -> accumulator.generate("s", "u", "m"));
    assertEquals("Backend returned HTTP 500: out of memory", e.getMessage());
    verify(backend, never()).tryListModels();
  }

  @Test
  @DisplayName("Transport and empty-response failures propagate")
  void failuresPropagate() {
    when(backend.complete(anyList(), anyString(), any()))
        .thenThrow(new BackendUnavailableException("refused", null))
        .thenThrow(new EmptyResponseException("nothing"));

    assertThrows(BackendUnavailableException.class, () -> accumulator.generate("s", "u", "m"));
    assertThrows(EmptyResponseException.class, () -> accumulator.generate("s", "u", "m"));
  }
}
