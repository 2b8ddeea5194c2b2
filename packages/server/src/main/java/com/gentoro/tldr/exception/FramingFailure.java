package com.gentoro.tldr.exception;

/** Reasons a request could not be read off the wire. */
public enum FramingFailure {
  /** Header block grew past the configured limit before the terminator was seen. */
  HEADER_TOO_LARGE(431, "Request Header Fields Too Large"),
  /** Declared body length is above the configured limit. */
  BODY_TOO_LARGE(413, "Payload Too Large"),
  /** A body-carrying request did not declare its length. */
  MISSING_LENGTH(411, "Length Required"),
  /** The peer closed the stream before the request was complete. */
  CONNECTION_CLOSED(400, "Bad Request"),
  /** The request line or a header could not be parsed. */
  MALFORMED_REQUEST(400, "Bad Request"),
  /** The peer stalled longer than the read timeout. */
  READ_TIMEOUT(408, "Request Timeout");

  private final int status;
  private final String reason;

  FramingFailure(int status, String reason) {
    this.status = status;
    this.reason = reason;
  }

  public int status() {
    return status;
  }

  public String reason() {
    return reason;
  }
}
