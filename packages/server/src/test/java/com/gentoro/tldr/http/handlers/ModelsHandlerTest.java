package com.gentoro.tldr.http.handlers;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.HttpStatus;
import com.gentoro.tldr.llm.CompletionBackend;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ModelsHandlerTest {

  private final CompletionBackend backend = mock(CompletionBackend.class);
  private final ModelsHandler handler = new ModelsHandler(backend, new ObjectMapper());

  @Test
  @DisplayName("Lists installed models")
  void listsModels() {
    when(backend.listModels()).thenReturn(List.of("a:1", "b:2"));
    HttpResponse response = handler.handle(HttpRequest.of("GET", "/api/models", new byte[0]));
    assertEquals(HttpStatus.OK, response.status());
    assertEquals("{\"models\":[\"a:1\",\"b:2\"]}", response.bodyAsString());
  }

  @Test
  @DisplayName("Backend failures yield an empty list, never an error")
  void emptyOnFailure() {
    when(backend.listModels()).thenThrow(new IllegalStateException("down"));
    HttpResponse response = handler.handle(HttpRequest.of("GET", "/api/models", new byte[0]));
    assertEquals(HttpStatus.OK, response.status());
    assertEquals("{\"models\":[]}", response.bodyAsString());
  }
}
