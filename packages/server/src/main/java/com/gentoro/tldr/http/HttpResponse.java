package com.gentoro.tldr.http;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A complete response. Serialization always emits {@code Content-Type}, {@code Content-Length}
 * and {@code Connection: close}; there is no streaming and no chunked encoding.
 */
public record HttpResponse(
    HttpStatus status, String contentType, byte[] body, Map<String, String> extraHeaders) {

  public static final String TEXT = "text/plain; charset=utf-8";
  public static final String JSON = "application/json";

  public HttpResponse {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(contentType, "contentType");
    body = body == null ? new byte[0] : body;
    extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
  }

  public static HttpResponse text(HttpStatus status, String message) {
    return new HttpResponse(status, TEXT, message.getBytes(StandardCharsets.UTF_8), Map.of());
  }

  public static HttpResponse json(HttpStatus status, String json) {
    return new HttpResponse(status, JSON, json.getBytes(StandardCharsets.UTF_8), Map.of());
  }

  public static HttpResponse gzipped(String contentType, byte[] compressed) {
    return new HttpResponse(
        HttpStatus.OK, contentType, compressed, Map.of("Content-Encoding", "gzip"));
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /** Serialize status line, headers and body, then flush. */
  public void writeTo(OutputStream out) throws IOException {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", contentType);
    headers.putAll(extraHeaders);
    headers.put("Content-Length", Integer.toString(body.length));
    headers.put("Connection", "close");

    StringBuilder head = new StringBuilder(128);
    head.append("HTTP/1.1 ").append(status.code()).append(' ').append(status.reason()).append("\r\n");
    headers.forEach((name, value) -> head.append(name).append(": ").append(value).append("\r\n"));
    head.append("\r\n");

    out.write(head.toString().getBytes(StandardCharsets.US_ASCII));
    out.write(body);
    out.flush();
  }
}
