package com.gentoro.tldr.exception;

/** The completion backend answered with a non-2xx status. */
public class BackendErrorException extends LlmException {
  private final int status;
  private final String body;

  public BackendErrorException(int status, String body) {
    this(status, body, "Backend returned HTTP %d: %s".formatted(status, body));
  }

  public BackendErrorException(int status, String body, String message) {
    super(message);
    this.status = status;
    this.body = body == null ? "" : body;
  }

  public int status() {
    return status;
  }

  public String body() {
    return body;
  }

  /** Heuristic used by Ollama and similar backends when the requested model is not installed. */
  public boolean suggestsMissingModel() {
    return status == 404 || body.toLowerCase().contains("not found");
  }
}
