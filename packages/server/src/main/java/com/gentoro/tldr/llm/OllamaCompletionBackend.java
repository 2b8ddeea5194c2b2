package com.gentoro.tldr.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tldr.client.OkHttpFactory;
import com.gentoro.tldr.config.OllamaSettings;
import com.gentoro.tldr.exception.BackendErrorException;
import com.gentoro.tldr.exception.BackendUnavailableException;
import com.gentoro.tldr.exception.EmptyResponseException;
import com.gentoro.tldr.exception.LlmException;
import com.gentoro.tldr.logging.LoggingService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * {@link CompletionBackend} talking to an Ollama server through its non-streaming chat API.
 *
 * <ul>
 *   <li>{@code POST /api/chat} with {@code stream=false}; a {@code done_reason} of {@code length}
 *       marks the turn as truncated.
 *   <li>{@code GET /api/tags} lists installed models.
 * </ul>
 */
public class OllamaCompletionBackend implements CompletionBackend {
  private static final Logger log = LoggingService.getLogger(OllamaCompletionBackend.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient chatClient;
  private final OkHttpClient listClient;
  private final String baseUrl;
  private final ObjectMapper mapper;

  public OllamaCompletionBackend(OkHttpClient client, OllamaSettings settings, ObjectMapper mapper) {
    this.chatClient = OkHttpFactory.withCallTimeout(client, settings.callTimeout());
    this.listClient = OkHttpFactory.withCallTimeout(client, settings.listTimeout());
    this.baseUrl = settings.baseUrl();
    this.mapper = mapper;
  }

  @Override
  public Completion complete(List<ChatMessage> messages, String model, CompletionOptions options) {
    Request request =
        new Request.Builder()
            .url(baseUrl + "/api/chat")
            .post(RequestBody.create(chatPayload(messages, model, options), JSON))
            .build();

    try (Response response = chatClient.newCall(request).execute()) {
      String body = bodyOf(response);
      if (!response.isSuccessful()) {
        throw new BackendErrorException(response.code(), body);
      }
      return parseChat(body);
    } catch (IOException e) {
      throw new BackendUnavailableException(
          "Could not reach Ollama at %s: %s".formatted(baseUrl, e.getMessage()), e);
    }
  }

  @Override
  public Optional<List<String>> tryListModels() {
    Request request = new Request.Builder().url(baseUrl + "/api/tags").get().build();
    try (Response response = listClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        log.debug("Model listing answered HTTP {}", response.code());
        return Optional.empty();
      }
      JsonNode models = mapper.readTree(bodyOf(response)).path("models");
      List<String> names = new ArrayList<>();
      for (JsonNode model : models) {
        String name = model.path("name").asText("");
        if (!name.isEmpty()) {
          names.add(name);
        }
      }
      return Optional.of(names);
    } catch (Exception e) {
      log.debug("Model listing failed: {}", e.toString());
      return Optional.empty();
    }
  }

  String chatPayload(List<ChatMessage> messages, String model, CompletionOptions options) {
    ObjectNode root = mapper.createObjectNode();
    root.put("model", model);
    root.put("stream", false);
    ArrayNode wireMessages = root.putArray("messages");
    for (ChatMessage message : messages) {
      wireMessages
          .addObject()
          .put("role", message.role().wireName())
          .put("content", message.content());
    }
    root.putObject("options")
        .put("temperature", options.temperature())
        .put("repeat_penalty", options.repeatPenalty())
        .put("num_ctx", options.contextSize())
        .put("num_predict", options.maxTokensPerTurn());
    try {
      return mapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new LlmException("Could not encode chat request", e);
    }
  }

  private Completion parseChat(String body) {
    JsonNode reply;
    try {
      reply = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new LlmException("Ollama returned a malformed chat response", e);
    }
    String content = reply.path("message").path("content").asText("");
    if (content.isBlank()) {
      throw new EmptyResponseException("Ollama returned no text in its response");
    }
    boolean truncated = "length".equalsIgnoreCase(reply.path("done_reason").asText(""));
    return new Completion(content, truncated);
  }

  private static String bodyOf(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }
}
