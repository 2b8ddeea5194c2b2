package com.gentoro.tldr.http;

import com.gentoro.tldr.logging.LoggingService;
import java.io.Closeable;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Bounds response writes. Blocking socket writes have no timeout of their own, so a write that
 * outlives its deadline gets its socket closed, which unblocks the writer with an exception.
 *
 * <p>The same timer closes rejected connections after their linger, off the accept thread.
 */
public final class WriteWatchdog implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(WriteWatchdog.class);

  private final Duration timeout;
  private final ScheduledExecutorService timer;
  private final Set<Socket> lingering = ConcurrentHashMap.newKeySet();

  public WriteWatchdog(Duration timeout) {
    this.timeout = timeout;
    this.timer =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "tldr-write-watchdog");
              t.setDaemon(true);
              return t;
            });
  }

  /** Arm a deadline for {@code socket}; close the returned guard once the write is done. */
  public Closeable guard(Socket socket) {
    ScheduledFuture<?> deadline =
        timer.schedule(
            () -> {
              log.warn(
                  "Write to {} exceeded {} ms, closing connection",
                  socket.getRemoteSocketAddress(),
                  timeout.toMillis());
              closeQuietly(socket);
            },
            timeout.toMillis(),
            TimeUnit.MILLISECONDS);
    return () -> deadline.cancel(false);
  }

  /**
   * Close {@code socket} after {@code delayMillis}.
   *
   * @return false if the watchdog is already closed and nothing was scheduled
   */
  public boolean closeLater(Socket socket, long delayMillis) {
    lingering.add(socket);
    try {
      timer.schedule(
          () -> {
            lingering.remove(socket);
            closeQuietly(socket);
          },
          delayMillis,
          TimeUnit.MILLISECONDS);
      return true;
    } catch (RejectedExecutionException e) {
      lingering.remove(socket);
      return false;
    }
  }

  @Override
  public void close() {
    timer.shutdownNow();
    for (Socket socket : lingering) {
      closeQuietly(socket);
    }
    lingering.clear();
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("Failed to close socket {}", socket.getRemoteSocketAddress(), e);
    }
  }
}
