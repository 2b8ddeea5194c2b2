package com.gentoro.tldr.jobs;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link JobRegistry} backed by a {@link HashMap}. Every operation holds a single lock for the
 * duration of the map access only.
 */
public final class InMemoryJobRegistry implements JobRegistry {

  private record Entry(JobState state, Instant updatedAt) {}

  private final Map<String, Entry> entries = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;

  public InMemoryJobRegistry() {
    this(Clock.systemUTC());
  }

  public InMemoryJobRegistry(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void insertPending(String id) {
    lock.lock();
    try {
      if (entries.containsKey(id)) {
        throw new IllegalStateException("Job id already registered: " + id);
      }
      entries.put(id, new Entry(JobState.PENDING, clock.instant()));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<JobState> get(String id) {
    lock.lock();
    try {
      Entry entry = entries.get(id);
      return entry == null ? Optional.empty() : Optional.of(entry.state());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean completeIfPending(String id, JobState state) {
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal state: " + state);
    }
    lock.lock();
    try {
      Entry current = entries.get(id);
      if (current == null || current.state().isTerminal()) {
        return false;
      }
      entries.put(id, new Entry(state, clock.instant()));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void remove(String id) {
    lock.lock();
    try {
      entries.remove(id);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int reapTerminalOlderThan(Instant cutoff) {
    lock.lock();
    try {
      int removed = 0;
      for (Iterator<Entry> it = entries.values().iterator(); it.hasNext(); ) {
        Entry entry = it.next();
        if (entry.state().isTerminal() && entry.updatedAt().isBefore(cutoff)) {
          it.remove();
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }
}
