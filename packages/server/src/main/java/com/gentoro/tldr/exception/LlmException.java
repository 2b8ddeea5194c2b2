package com.gentoro.tldr.exception;

/** Errors raised while talking to the completion backend. */
public class LlmException extends TldrException {
  public LlmException(String message) {
    super(TldrErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(TldrErrorCode.LLM_ERROR, message, cause);
  }
}
