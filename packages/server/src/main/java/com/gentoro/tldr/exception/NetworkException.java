package com.gentoro.tldr.exception;

/** The listener could not be bound or the socket layer failed outside a single connection. */
public class NetworkException extends TldrException {
  public NetworkException(String message, Throwable cause) {
    super(TldrErrorCode.NETWORK_ERROR, message, cause);
  }
}
