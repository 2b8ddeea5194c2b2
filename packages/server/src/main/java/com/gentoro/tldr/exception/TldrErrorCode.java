package com.gentoro.tldr.exception;

/** Stable error codes attached to every {@link TldrException}. */
public enum TldrErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  FRAMING_ERROR,
  BAD_REQUEST,
  JOB_REJECTED,
  TRANSCRIPT_ERROR,
  LLM_ERROR
}
