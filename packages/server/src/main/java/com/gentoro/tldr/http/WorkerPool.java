package com.gentoro.tldr.http;

import com.gentoro.tldr.exception.ExceptionUtil;
import com.gentoro.tldr.logging.LoggingService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Fixed set of long-lived workers draining the {@link DispatchQueue}. Each worker handles one
 * connection from framing to the last written byte before taking the next one.
 */
public final class WorkerPool {
  private static final Logger log = LoggingService.getLogger(WorkerPool.class);

  private final DispatchQueue<ConnectionWorkItem> queue;
  private final ConnectionHandler handler;
  private final WriteWatchdog watchdog;
  private final int size;
  private final List<Thread> threads = new ArrayList<>();

  public WorkerPool(
      DispatchQueue<ConnectionWorkItem> queue,
      ConnectionHandler handler,
      WriteWatchdog watchdog,
      int size) {
    this.queue = queue;
    this.handler = handler;
    this.watchdog = watchdog;
    this.size = size;
  }

  public synchronized void start() {
    if (!threads.isEmpty()) {
      return;
    }
    for (int i = 1; i <= size; i++) {
      // Attach before the thread runs so the queue never reports a started pool as disconnected.
      queue.attachReceiver();
      Thread t = new Thread(this::runWorker, "tldr-worker-" + i);
      t.setDaemon(true);
      threads.add(t);
      t.start();
    }
    log.debug("Started {} connection workers", size);
  }

  /** Close the queue and wait up to {@code timeoutMillis} for each worker to exit. */
  public synchronized void stop(long timeoutMillis) throws InterruptedException {
    queue.close();
    for (Thread t : threads) {
      t.join(timeoutMillis);
      if (t.isAlive()) {
        log.warn("{} still busy at shutdown, interrupting it", t.getName());
        t.interrupt();
      }
    }
    threads.clear();
  }

  private void runWorker() {
    try {
      while (true) {
        Optional<ConnectionWorkItem> next;
        try {
          next = queue.receive();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
        if (next.isEmpty()) {
          break;
        }
        process(next.get());
      }
    } finally {
      int remaining = queue.detachReceiver();
      log.debug("{} exiting, {} workers left", Thread.currentThread().getName(), remaining);
      if (remaining == 0 && !queue.isClosed()) {
        failQueued();
      }
    }
  }

  /** The last worker is gone: nobody will take what is still queued. */
  private void failQueued() {
    List<ConnectionWorkItem> stranded = queue.drain();
    if (stranded.isEmpty()) {
      return;
    }
    log.error("No connection worker left, answering {} queued connections", stranded.size());
    for (ConnectionWorkItem item : stranded) {
      try {
        item.respond(
            HttpResponse.text(
                HttpStatus.INTERNAL_SERVER_ERROR, TldrHttpServer.DISCONNECTED_MESSAGE),
            watchdog);
      } catch (IOException | RuntimeException e) {
        log.debug("Could not notify {}: {}", item.remoteAddress(), e.toString());
      } finally {
        item.close();
      }
    }
  }

  void process(ConnectionWorkItem item) {
    try {
      HttpResponse response = handler.handle(item.input());
      item.respond(response, watchdog);
    } catch (IOException e) {
      log.debug("Could not write response to {}: {}", item.remoteAddress(), e.toString());
    } catch (Exception e) {
      log.warn("Worker failed on connection from {}: {}", item.remoteAddress(), e.toString());
      log.debug("Worker failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      respondWithError(item, e);
    } catch (Error e) {
      log.error("Worker crashed on connection from {}", item.remoteAddress(), e);
      respondWithError(item, e);
      throw e;
    } finally {
      item.close();
    }
  }

  private void respondWithError(ConnectionWorkItem item, Throwable failure) {
    if (item.hasResponded()) {
      return;
    }
    try {
      item.respond(
          HttpResponse.text(
              HttpStatus.INTERNAL_SERVER_ERROR, ExceptionUtil.extractErrorMessage(failure)),
          watchdog);
    } catch (IOException | RuntimeException e) {
      log.debug("Best-effort error response to {} failed: {}", item.remoteAddress(), e.toString());
    }
  }
}
