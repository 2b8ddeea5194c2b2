package com.gentoro.tldr.exception;

/** Raised by the request framer; the failure decides the status code sent back, if any. */
public class FramingException extends TldrException {
  private final FramingFailure failure;

  public FramingException(FramingFailure failure, String message) {
    super(TldrErrorCode.FRAMING_ERROR, message);
    this.failure = failure;
  }

  public FramingException(FramingFailure failure, String message, Throwable cause) {
    super(TldrErrorCode.FRAMING_ERROR, message, cause);
    this.failure = failure;
  }

  public FramingFailure failure() {
    return failure;
  }

  /** Whether a response can still reach the peer. */
  public boolean isRespondable() {
    return failure != FramingFailure.CONNECTION_CLOSED;
  }
}
