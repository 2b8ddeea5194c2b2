package com.gentoro.tldr.jobs;

import java.util.Objects;

/**
 * Lifecycle state of a background job. {@link Done} and {@link Error} are terminal: once a job
 * reaches one of them its state never changes again.
 */
public sealed interface JobState permits JobState.Pending, JobState.Done, JobState.Error {

  Pending PENDING = new Pending();

  boolean isTerminal();

  /** Accepted, not finished yet. */
  record Pending() implements JobState {
    @Override
    public boolean isTerminal() {
      return false;
    }
  }

  /** Finished successfully with an opaque result payload. */
  record Done(Object result) implements JobState {
    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** Finished with a failure. */
  record Error(String message) implements JobState {
    public Error {
      message = Objects.requireNonNullElse(message, "Unknown error");
    }

    @Override
    public boolean isTerminal() {
      return true;
    }
  }
}
