package com.gentoro.tldr.jobs;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ids shaped like {@code job-<epoch-millis>-<sequence>}. The sequence alone guarantees uniqueness
 * within a process; the timestamp only makes ids traceable in logs.
 */
public final class DefaultJobIdGenerator implements JobIdGenerator {
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public DefaultJobIdGenerator() {
    this(Clock.systemUTC());
  }

  public DefaultJobIdGenerator(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String nextId() {
    return "job-%d-%d".formatted(clock.millis(), sequence.incrementAndGet());
  }
}
