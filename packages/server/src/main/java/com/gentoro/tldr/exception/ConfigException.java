package com.gentoro.tldr.exception;

/** Missing or invalid configuration detected at startup. */
public class ConfigException extends TldrException {
  public ConfigException(String message) {
    super(TldrErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TldrErrorCode.CONFIG_ERROR, message, cause);
  }
}
