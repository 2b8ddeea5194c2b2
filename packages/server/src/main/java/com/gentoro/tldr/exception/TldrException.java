package com.gentoro.tldr.exception;

/** Base unchecked exception for the service. Carries a {@link TldrErrorCode}. */
public class TldrException extends RuntimeException {
  private final TldrErrorCode code;

  public TldrException(TldrErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public TldrException(TldrErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public TldrErrorCode getCode() {
    return code;
  }
}
