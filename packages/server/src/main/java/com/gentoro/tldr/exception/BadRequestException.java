package com.gentoro.tldr.exception;

/** The client sent a request that is well framed but semantically unusable. */
public class BadRequestException extends TldrException {
  public BadRequestException(String message) {
    super(TldrErrorCode.BAD_REQUEST, message);
  }

  public BadRequestException(String message, Throwable cause) {
    super(TldrErrorCode.BAD_REQUEST, message, cause);
  }
}
