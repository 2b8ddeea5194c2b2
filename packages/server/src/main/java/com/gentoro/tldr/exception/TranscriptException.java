package com.gentoro.tldr.exception;

/** Domain errors raised by a transcript source. */
public class TranscriptException extends TldrException {

  public enum Kind {
    INVALID_REFERENCE,
    NO_CAPTIONS,
    BLOCKED,
    FETCH_FAILED
  }

  private final Kind kind;

  public TranscriptException(Kind kind, String message) {
    super(TldrErrorCode.TRANSCRIPT_ERROR, message);
    this.kind = kind;
  }

  public TranscriptException(Kind kind, String message, Throwable cause) {
    super(TldrErrorCode.TRANSCRIPT_ERROR, message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
