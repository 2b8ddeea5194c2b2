package com.gentoro.tldr.jobs;

import com.gentoro.tldr.config.JobSettings;
import com.gentoro.tldr.exception.ExceptionUtil;
import com.gentoro.tldr.exception.JobRejectedException;
import com.gentoro.tldr.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Asynchronous job manager.
 *
 * <p>Jobs run on a fixed-size pool with a bounded backlog, separate from the connection workers,
 * so that slow jobs never occupy a connection worker and a flood of submissions is rejected instead
 * of spawning threads without limit. A job's id is registered as pending before it is scheduled
 * and before it is returned, so an immediate poll always finds it. Finished jobs are dropped by a
 * periodic reaper once they are older than the configured retention.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobManager.class);

  private final JobRegistry registry;
  private final JobIdGenerator ids;
  private final ThreadPoolExecutor executor;
  private final ScheduledExecutorService reaper;
  private final Clock clock;

  public JobManager(JobRegistry registry, JobIdGenerator ids, JobSettings settings) {
    this(registry, ids, settings, Clock.systemUTC());
  }

  public JobManager(JobRegistry registry, JobIdGenerator ids, JobSettings settings, Clock clock) {
    this.registry = registry;
    this.ids = ids;
    this.clock = clock;
    this.executor =
        new ThreadPoolExecutor(
            settings.workers(),
            settings.workers(),
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(settings.queueCapacity()),
            namedDaemonThreads("tldr-job"),
            new ThreadPoolExecutor.AbortPolicy());

    if (settings.retention().isZero()) {
      this.reaper = null;
    } else {
      this.reaper = Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("tldr-job-reaper"));
      long interval = settings.reapInterval().toMillis();
      reaper.scheduleWithFixedDelay(
          () -> reap(settings.retention()), interval, interval, TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Schedule {@code work} and return the id under which its outcome can be polled.
   *
   * @param kind short label used in logs
   * @throws JobRejectedException if the job backlog is full
   */
  public String submit(String kind, Callable<?> work) {
    String id = ids.nextId();
    registry.insertPending(id);
    try {
      executor.execute(() -> run(id, kind, work));
    } catch (RejectedExecutionException e) {
      registry.remove(id);
      log.warn("Rejected {} job: job queue is full", kind);
      throw new JobRejectedException("Job queue is full, please try again later.", e);
    }
    log.info("Submitted {} job {}", kind, id);
    return id;
  }

  public Optional<JobState> status(String id) {
    return registry.get(id);
  }

  private void run(String id, String kind, Callable<?> work) {
    long start = System.currentTimeMillis();
    JobState outcome;
    try {
      outcome = new JobState.Done(work.call());
    } catch (Exception e) {
      log.error("Job {} ({}) failed: {}", id, kind, e.toString());
      log.debug("Job {} failure trace: {}", id, ExceptionUtil.formatCompactStackTrace(e));
      outcome = new JobState.Error(ExceptionUtil.extractErrorMessage(e));
    } catch (Error e) {
      log.error("Job {} ({}) crashed", id, kind, e);
      registry.completeIfPending(id, new JobState.Error(ExceptionUtil.extractErrorMessage(e)));
      throw e;
    }
    if (registry.completeIfPending(id, outcome)) {
      log.info(
          "Job {} ({}) finished as {} in {} ms",
          id,
          kind,
          outcome instanceof JobState.Done ? "done" : "error",
          System.currentTimeMillis() - start);
    } else {
      log.warn("Job {} was no longer pending, outcome discarded", id);
    }
  }

  void reap(Duration retention) {
    try {
      int removed = registry.reapTerminalOlderThan(clock.instant().minus(retention));
      if (removed > 0) {
        log.debug("Reaped {} finished job(s)", removed);
      }
    } catch (RuntimeException e) {
      // An exception would cancel the periodic schedule.
      log.warn("Job reaping failed", e);
    }
  }

  @Override
  public void close() {
    if (reaper != null) {
      reaper.shutdownNow();
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
        log.warn("Jobs still running at shutdown, interrupting them");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  static ThreadFactory namedDaemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
