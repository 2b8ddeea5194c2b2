package com.gentoro.tldr.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A framed request. The body is only read from the connection when a handler asks for it, so
 * routes without a body never require {@code Content-Length}.
 */
public final class HttpRequest {
  private final RequestHead head;
  private final Supplier<byte[]> bodyReader;
  private byte[] body;

  public HttpRequest(RequestHead head, Supplier<byte[]> bodyReader) {
    this.head = head;
    this.bodyReader = bodyReader;
  }

  /** Request with an already known body; used where no connection is involved. */
  public static HttpRequest of(String method, String target, byte[] body) {
    RequestHead head =
        new RequestHead(
            method,
            target,
            List.of(
                new RequestHead.Header("Content-Length", Integer.toString(body.length))),
            body);
    return new HttpRequest(head, () -> body);
  }

  public String method() {
    return head.method();
  }

  public String path() {
    return head.path();
  }

  public Map<String, String> queryParameters() {
    return head.queryParameters();
  }

  public Optional<String> header(String name) {
    return head.header(name);
  }

  /** Body bytes, read on first access. */
  public byte[] body() {
    if (body == null) {
      body = bodyReader.get();
    }
    return body;
  }

  public String bodyAsString() {
    return new String(body(), StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return head.method() + " " + head.target();
  }
}
