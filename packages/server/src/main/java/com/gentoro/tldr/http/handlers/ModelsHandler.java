package com.gentoro.tldr.http.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.RouteHandler;
import com.gentoro.tldr.llm.CompletionBackend;
import com.gentoro.tldr.logging.LoggingService;
import java.util.List;
import org.slf4j.Logger;

/** {@code GET /api/models}: installed model names, an empty list when the backend is down. */
public final class ModelsHandler implements RouteHandler {
  private static final Logger log = LoggingService.getLogger(ModelsHandler.class);

  private final CompletionBackend backend;
  private final ObjectMapper mapper;

  public ModelsHandler(CompletionBackend backend, ObjectMapper mapper) {
    this.backend = backend;
    this.mapper = mapper;
  }

  @Override
  public HttpResponse handle(HttpRequest request) {
    List<String> models;
    try {
      models = backend.listModels();
    } catch (RuntimeException e) {
      log.warn("Model listing failed: {}", e.toString());
      models = List.of();
    }
    ObjectNode payload = mapper.createObjectNode();
    ArrayNode names = payload.putArray("models");
    models.forEach(names::add);
    return JsonBodies.ok(mapper, payload);
  }
}
