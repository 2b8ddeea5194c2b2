package com.gentoro.tldr.http;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed request line and headers, plus any body bytes that were read together with the header
 * block.
 *
 * @param method request method, as sent
 * @param target raw request target including the query string
 * @param headers header lines in arrival order
 * @param bodyPrefix bytes that followed the header terminator in the last read
 */
public record RequestHead(
    String method, String target, List<Header> headers, byte[] bodyPrefix) {

  /** A single header line. Names keep their original case. */
  public record Header(String name, String value) {}

  public RequestHead {
    headers = List.copyOf(headers);
    bodyPrefix = bodyPrefix == null ? new byte[0] : bodyPrefix;
  }

  /** The target without its query string. */
  public String path() {
    int q = target.indexOf('?');
    return q < 0 ? target : target.substring(0, q);
  }

  /** Decoded query parameters; for repeated names the first occurrence wins. */
  public Map<String, String> queryParameters() {
    int q = target.indexOf('?');
    if (q < 0 || q == target.length() - 1) {
      return Map.of();
    }
    Map<String, String> params = new LinkedHashMap<>();
    for (String pair : target.substring(q + 1).split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = decode(eq < 0 ? pair : pair.substring(0, eq));
      String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      params.putIfAbsent(name, value);
    }
    return Collections.unmodifiableMap(params);
  }

  /** Case-insensitive lookup; the first matching header wins. */
  public Optional<String> header(String name) {
    for (Header header : headers) {
      if (header.name().equalsIgnoreCase(name)) {
        return Optional.of(header.value());
      }
    }
    return Optional.empty();
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return value;
    }
  }
}
