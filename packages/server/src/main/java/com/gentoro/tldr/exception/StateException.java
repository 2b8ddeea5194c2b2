package com.gentoro.tldr.exception;

/** A component was used in a state that does not allow the operation. */
public class StateException extends TldrException {
  public StateException(String message) {
    super(TldrErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(TldrErrorCode.STATE_ERROR, message, cause);
  }
}
