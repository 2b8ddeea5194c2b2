package com.gentoro.tldr.jobs;

import java.time.Instant;
import java.util.Optional;

/** Shared mapping from job id to {@link JobState}. Implementations must be thread safe. */
public interface JobRegistry {

  /**
   * Register a new job as {@link JobState.Pending}.
   *
   * @throws IllegalStateException if the id is already known
   */
  void insertPending(String id);

  Optional<JobState> get(String id);

  /**
   * Move a pending job to a terminal state.
   *
   * @return {@code false} if the job is unknown or already terminal, in which case nothing changes
   * @throws IllegalArgumentException if {@code state} is not terminal
   */
  boolean completeIfPending(String id, JobState state);

  /** Forget a job. Only used when a job could not be scheduled and its id was never handed out. */
  void remove(String id);

  /**
   * Drop terminal jobs that finished before {@code cutoff}. Pending jobs are always kept.
   *
   * @return number of removed entries
   */
  int reapTerminalOlderThan(Instant cutoff);

  int size();
}
