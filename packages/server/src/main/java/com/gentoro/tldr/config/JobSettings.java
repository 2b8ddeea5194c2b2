package com.gentoro.tldr.config;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Background job execution.
 *
 * @param workers threads executing submitted jobs
 * @param queueCapacity jobs waiting for a thread; beyond this a submission is rejected
 * @param retention how long finished jobs stay pollable, {@link Duration#ZERO} keeps them forever
 * @param reapInterval how often finished jobs are checked against the retention
 */
public record JobSettings(int workers, int queueCapacity, Duration retention, Duration reapInterval) {

  public static JobSettings from(Configuration config) {
    return new JobSettings(
        Settings.positiveInt(config, "jobs.workers", 4),
        Settings.positiveInt(config, "jobs.queue-capacity", 100),
        Duration.ofMinutes(Settings.nonNegativeLong(config, "jobs.retention-minutes", 60)),
        Duration.ofSeconds(Settings.positiveLong(config, "jobs.reap-interval-seconds", 60)));
  }
}
