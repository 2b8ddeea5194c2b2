package com.gentoro.tldr.client;

import com.gentoro.tldr.logging.LoggingService;
import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/** Logs outbound requests and their outcome. Bodies are only logged at TRACE. */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);
  private static final long MAX_LOGGED_BODY = 4096;

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("➡️ {} {}", request.method(), request.url());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000;
      log.warn(
          "Request failed: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          durationMs,
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    long durationMs = (System.nanoTime() - startTime) / 1_000_000;
    log.debug(
        "⬅️ {} {} answered {} in {} ms",
        request.method(),
        request.url(),
        response.code(),
        durationMs);
    if (log.isTraceEnabled()) {
      try {
        ResponseBody peeked = response.peekBody(MAX_LOGGED_BODY);
        log.trace("Response body:\n{}", peeked.string());
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
    }
    return response;
  }
}
