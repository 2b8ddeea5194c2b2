package com.gentoro.tldr.http.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tldr.exception.BadRequestException;
import com.gentoro.tldr.exception.TldrException;
import com.gentoro.tldr.exception.TldrErrorCode;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.HttpStatus;
import java.io.IOException;

/** JSON (de)serialization shared by the API handlers. */
final class JsonBodies {
  private JsonBodies() {}

  static <T> T read(ObjectMapper mapper, HttpRequest request, Class<T> type) {
    byte[] body = request.body();
    if (body.length == 0) {
      throw new BadRequestException("Request body is required");
    }
    try {
      T value = mapper.readValue(body, type);
      if (value == null) {
        throw new BadRequestException("Request body is required");
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new BadRequestException("Invalid JSON body: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new BadRequestException("Unreadable request body: " + e.getMessage(), e);
    }
  }

  static HttpResponse ok(ObjectMapper mapper, Object payload) {
    return write(mapper, HttpStatus.OK, payload);
  }

  static HttpResponse write(ObjectMapper mapper, HttpStatus status, Object payload) {
    try {
      return HttpResponse.json(status, mapper.writeValueAsString(payload));
    } catch (JsonProcessingException e) {
      throw new TldrException(TldrErrorCode.UNKNOWN, "Failed to encode response", e);
    }
  }
}
