package com.gentoro.tldr.http;

import com.gentoro.tldr.logging.LoggingService;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * One accepted connection that has not been read yet. Owned by the accept loop until it is queued
 * and by exactly one worker afterwards; whoever owns it last closes it.
 */
public final class ConnectionWorkItem implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(ConnectionWorkItem.class);
  private static final int DRAIN_LIMIT_BYTES = 64 * 1024;
  private static final long DRAIN_BUDGET_MILLIS = 250;
  static final long REJECT_LINGER_MILLIS = 250;

  private final Socket socket;
  private final long acceptedAtNanos;
  private boolean responded;
  private boolean closed;

  public ConnectionWorkItem(Socket socket) {
    this.socket = socket;
    this.acceptedAtNanos = System.nanoTime();
  }

  public InputStream input() throws IOException {
    return socket.getInputStream();
  }

  public SocketAddress remoteAddress() {
    return socket.getRemoteSocketAddress();
  }

  public boolean hasResponded() {
    return responded;
  }

  /** Time since the connection was accepted. */
  public long ageMillis() {
    return (System.nanoTime() - acceptedAtNanos) / 1_000_000;
  }

  /** Write {@code response} under the watchdog's deadline. At most one response is written. */
  public void respond(HttpResponse response, WriteWatchdog watchdog) throws IOException {
    if (responded) {
      log.debug("Response already written to {}, dropping {}", remoteAddress(), response.status());
      return;
    }
    responded = true;
    OutputStream out = socket.getOutputStream();
    try (Closeable ignored = watchdog.guard(socket)) {
      response.writeTo(out);
    }
  }

  /**
   * Close after half-closing the output and discarding unread input, so the peer receives the
   * response instead of a reset caused by unread request bytes. The drain stops after 64 KiB or
   * 250 ms in total, whichever comes first.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (!socket.isClosed()) {
        socket.shutdownOutput();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(DRAIN_BUDGET_MILLIS);
        InputStream in = socket.getInputStream();
        byte[] scratch = new byte[4096];
        int drained = 0;
        while (drained < DRAIN_LIMIT_BYTES) {
          long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
          if (remaining <= 0) {
            break;
          }
          socket.setSoTimeout((int) remaining);
          int read = in.read(scratch);
          if (read <= 0) {
            break;
          }
          drained += read;
        }
      }
    } catch (IOException e) {
      log.trace("Ignoring error while draining {}: {}", remoteAddress(), e.toString());
    } finally {
      closeSocket();
    }
  }

  /**
   * Close without reading from the peer. The output is half-closed at once and {@code watchdog}
   * closes the socket after a short linger, so the caller never waits on the peer.
   */
  public void closeWithoutDrain(WriteWatchdog watchdog) {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (!socket.isClosed()) {
        socket.shutdownOutput();
      }
    } catch (IOException e) {
      log.trace("Ignoring error while half-closing {}: {}", remoteAddress(), e.toString());
    }
    if (!watchdog.closeLater(socket, REJECT_LINGER_MILLIS)) {
      closeSocket();
    }
  }

  private void closeSocket() {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("Failed to close connection from {}", remoteAddress(), e);
    }
  }
}
