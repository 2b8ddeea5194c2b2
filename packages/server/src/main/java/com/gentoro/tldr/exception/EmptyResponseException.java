package com.gentoro.tldr.exception;

/** A completion turn came back without any usable text. */
public class EmptyResponseException extends LlmException {
  public EmptyResponseException(String message) {
    super(message);
  }
}
