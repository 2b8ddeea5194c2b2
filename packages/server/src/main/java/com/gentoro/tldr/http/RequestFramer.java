package com.gentoro.tldr.http;

import com.gentoro.tldr.exception.FramingException;
import com.gentoro.tldr.exception.FramingFailure;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Minimal HTTP/1.1 request framing: a header block terminated by {@code CRLF CRLF}, followed by a
 * body whose size is given by {@code Content-Length}. Chunked transfer encoding, keep-alive and
 * pipelining are not supported.
 */
public class RequestFramer {
  private static final byte[] TERMINATOR = {'\r', '\n', '\r', '\n'};
  private static final int CHUNK_SIZE = 1024;

  private final int maxHeaderBytes;
  private final int maxBodyBytes;

  public RequestFramer(int maxHeaderBytes, int maxBodyBytes) {
    this.maxHeaderBytes = maxHeaderBytes;
    this.maxBodyBytes = maxBodyBytes;
  }

  /** Read and parse the header block. Bytes read past the terminator are kept as body prefix. */
  public RequestHead readHead(InputStream in) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(CHUNK_SIZE);
    byte[] chunk = new byte[CHUNK_SIZE];
    int searchFrom = 0;
    while (true) {
      int read = read(in, chunk, 0, chunk.length);
      if (read <= 0) {
        throw new FramingException(
            FramingFailure.CONNECTION_CLOSED, "Connection closed while reading headers");
      }
      buffer.write(chunk, 0, read);
      byte[] data = buffer.toByteArray();

      int terminatorAt = indexOf(data, TERMINATOR, searchFrom);
      if (terminatorAt >= 0) {
        int bodyStart = terminatorAt + TERMINATOR.length;
        return parseHead(
            new String(data, 0, terminatorAt, StandardCharsets.ISO_8859_1),
            Arrays.copyOfRange(data, bodyStart, data.length));
      }
      if (data.length > maxHeaderBytes) {
        throw new FramingException(FramingFailure.HEADER_TOO_LARGE, "Headers too large");
      }
      // The terminator may straddle two reads.
      searchFrom = Math.max(0, data.length - (TERMINATOR.length - 1));
    }
  }

  /**
   * Read exactly the declared body. The declared length is validated before anything else is read
   * from the stream.
   */
  public byte[] readBody(RequestHead head, InputStream in) {
    String declared =
        head.header("Content-Length")
            .orElseThrow(
                () ->
                    new FramingException(
                        FramingFailure.MISSING_LENGTH,
                        "Content-Length header is required for " + head.method()));
    long length;
    try {
      length = Long.parseLong(declared.trim());
    } catch (NumberFormatException e) {
      throw new FramingException(
          FramingFailure.MALFORMED_REQUEST, "Invalid Content-Length: " + declared, e);
    }
    if (length < 0) {
      throw new FramingException(
          FramingFailure.MALFORMED_REQUEST, "Invalid Content-Length: " + declared);
    }
    if (length > maxBodyBytes) {
      throw new FramingException(
          FramingFailure.BODY_TOO_LARGE,
          "Request body too large (%d bytes, limit %d)".formatted(length, maxBodyBytes));
    }

    int size = (int) length;
    byte[] prefix = head.bodyPrefix();
    if (prefix.length >= size) {
      return Arrays.copyOf(prefix, size);
    }
    byte[] body = Arrays.copyOf(prefix, size);
    int filled = prefix.length;
    while (filled < size) {
      int read = read(in, body, filled, size - filled);
      if (read <= 0) {
        throw new FramingException(
            FramingFailure.CONNECTION_CLOSED,
            "Connection closed after %d of %d body bytes".formatted(filled, size));
      }
      filled += read;
    }
    return body;
  }

  private static RequestHead parseHead(String block, byte[] bodyPrefix) {
    String[] lines = block.split("\r\n");
    int first = 0;
    // Tolerate stray empty lines before the request line.
    while (first < lines.length && lines[first].isEmpty()) {
      first++;
    }
    if (first == lines.length) {
      throw new FramingException(FramingFailure.MALFORMED_REQUEST, "Empty request");
    }
    String[] requestLine = lines[first].trim().split(" +");
    if (requestLine.length < 2 || requestLine[0].isEmpty() || !requestLine[1].startsWith("/")) {
      throw new FramingException(
          FramingFailure.MALFORMED_REQUEST, "Malformed request line: " + lines[first]);
    }

    List<RequestHead.Header> headers = new ArrayList<>();
    for (int i = first + 1; i < lines.length; i++) {
      String line = lines[i];
      int colon = line.indexOf(':');
      if (colon <= 0) {
        throw new FramingException(
            FramingFailure.MALFORMED_REQUEST, "Malformed header line: " + line);
      }
      headers.add(
          new RequestHead.Header(line.substring(0, colon).trim(), line.substring(colon + 1).trim()));
    }
    return new RequestHead(requestLine[0], requestLine[1], headers, bodyPrefix);
  }

  private static int read(InputStream in, byte[] buffer, int offset, int length) {
    try {
      return in.read(buffer, offset, length);
    } catch (SocketTimeoutException e) {
      throw new FramingException(FramingFailure.READ_TIMEOUT, "Timed out reading request", e);
    } catch (IOException e) {
      throw new FramingException(
          FramingFailure.CONNECTION_CLOSED, "Read failed: " + e.getMessage(), e);
    }
  }

  static int indexOf(byte[] data, byte[] needle, int from) {
    outer:
    for (int i = Math.max(0, from); i <= data.length - needle.length; i++) {
      for (int j = 0; j < needle.length; j++) {
        if (data[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }
}
