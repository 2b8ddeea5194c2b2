package com.gentoro.tldr.exception;

/** The job executor is saturated and refused a new job. */
public class JobRejectedException extends TldrException {
  public JobRejectedException(String message, Throwable cause) {
    super(TldrErrorCode.JOB_REJECTED, message, cause);
  }
}
