package com.gentoro.tldr.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-capacity FIFO between the accept loop and the workers.
 *
 * <p>Producers never block: {@link #offer} answers immediately with an {@link Admission}. The
 * queue counts attached receivers so that a pool whose workers have all died reports {@link
 * Admission#DISCONNECTED} instead of silently accepting work nobody will take.
 *
 * @param <T> work item type
 */
public final class DispatchQueue<T> {
  private static final long RECEIVE_POLL_MILLIS = 200;

  /** Outcome of a non-blocking enqueue. */
  public enum Admission {
    ACCEPTED,
    BUSY,
    DISCONNECTED
  }

  private final BlockingQueue<T> items;
  private final AtomicInteger receivers = new AtomicInteger();
  private volatile boolean closed;

  public DispatchQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.items = new ArrayBlockingQueue<>(capacity);
  }

  public Admission offer(T item) {
    if (closed || receivers.get() == 0) {
      return Admission.DISCONNECTED;
    }
    if (!items.offer(item)) {
      return Admission.BUSY;
    }
    // The last receiver may have detached and drained between the check and the insert.
    if (receivers.get() == 0 && items.remove(item)) {
      return Admission.DISCONNECTED;
    }
    return Admission.ACCEPTED;
  }

  /**
   * Wait for the next item.
   *
   * @return the item, or empty once the queue has been closed
   */
  public Optional<T> receive() throws InterruptedException {
    while (!closed) {
      T item = items.poll(RECEIVE_POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (item != null) {
        return Optional.of(item);
      }
    }
    return Optional.empty();
  }

  public void attachReceiver() {
    receivers.incrementAndGet();
  }

  /** @return the number of receivers still attached */
  public int detachReceiver() {
    return receivers.decrementAndGet();
  }

  public int size() {
    return items.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /** Stop admitting items; receivers see the closure on their next wait. */
  public void close() {
    closed = true;
  }

  /** Remove and return whatever is still queued. */
  public List<T> drain() {
    List<T> remaining = new ArrayList<>();
    items.drainTo(remaining);
    return remaining;
  }
}
