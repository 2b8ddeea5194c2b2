package com.gentoro.tldr.exception;

/** The completion backend could not be reached (connect failure, reset, timeout). */
public class BackendUnavailableException extends LlmException {
  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
