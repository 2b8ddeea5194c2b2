package com.gentoro.tldr.http;

import com.gentoro.tldr.config.ServerSettings;
import com.gentoro.tldr.exception.ExceptionUtil;
import com.gentoro.tldr.exception.NetworkException;
import com.gentoro.tldr.logging.LoggingService;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import org.slf4j.Logger;

/**
 * Listener, accept loop, dispatch queue and connection workers.
 *
 * <p>The accept loop never blocks on the queue: when it is full the connection is answered with
 * 503 on the accept thread and closed, and when no worker is left to drain it the answer is 500.
 * Every connection carries exactly one request.
 */
public class TldrHttpServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(TldrHttpServer.class);

  static final String BUSY_MESSAGE = "Server is busy, please try again later.";
  static final String DISCONNECTED_MESSAGE = "Worker pool has been disconnected.";
  private static final int ACCEPT_BACKLOG = 128;
  private static final long WORKER_STOP_MILLIS = 2000;
  private static final long ACCEPT_RETRY_MILLIS = 50;

  private final ServerSettings settings;
  private final Router router;
  private final Object lifecycleLock = new Object();

  private ServerSocket listener;
  private DispatchQueue<ConnectionWorkItem> queue;
  private WorkerPool workers;
  private WriteWatchdog watchdog;
  private Thread acceptThread;
  private volatile boolean running;

  public TldrHttpServer(ServerSettings settings, Router router) {
    this.settings = settings;
    this.router = router;
  }

  /** Bind the listener and build the worker pool without accepting connections yet. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (listener != null) {
        log.trace("Server already prepared");
        return;
      }
      try {
        ServerSocket socket = openListener();
        socket.setReuseAddress(true);
        socket.bind(
            new InetSocketAddress(settings.hostname(), settings.port()), ACCEPT_BACKLOG);
        listener = socket;
      } catch (IOException e) {
        throw new NetworkException(
            "Failed to bind %s:%d. Check that the address is free and this process may listen on it"
                .formatted(settings.hostname(), settings.port()),
            e);
      }
      queue = new DispatchQueue<>(settings.queueCapacity());
      watchdog = new WriteWatchdog(settings.writeTimeout());
      ConnectionHandler handler =
          new ConnectionHandler(
              new RequestFramer(settings.maxHeaderBytes(), settings.maxBodyBytes()), router);
      workers = new WorkerPool(queue, handler, watchdog, settings.workers());
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (running) {
        log.trace("Server already started");
        return;
      }
      if (listener == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      workers.start();
      running = true;
      ServerSocket serverSocket = listener;
      acceptThread = new Thread(() -> acceptLoop(serverSocket), "tldr-accept");
      acceptThread.start();
      log.info(
          "Listening on http://{}:{} with {} workers, queue capacity {}",
          settings.hostname(),
          listener.getLocalPort(),
          settings.workers(),
          settings.queueCapacity());
    }
  }

  private void acceptLoop(ServerSocket serverSocket) {
    while (running && !serverSocket.isClosed()) {
      Socket socket;
      try {
        socket = serverSocket.accept();
      } catch (IOException e) {
        if (!running || serverSocket.isClosed()) {
          break;
        }
        // Per-connection failures (EMFILE, ECONNABORTED) must not end the loop.
        log.warn("Accept failed: {}", e.toString());
        if (!backOff()) {
          break;
        }
        continue;
      }
      admit(socket);
    }
    log.debug("Accept loop exited");
  }

  private static boolean backOff() {
    try {
      Thread.sleep(ACCEPT_RETRY_MILLIS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Unbound listener socket; {@link #prepare()} binds it. */
  ServerSocket openListener() throws IOException {
    return new ServerSocket();
  }

  void admit(Socket socket) {
    ConnectionWorkItem item = new ConnectionWorkItem(socket);
    try {
      socket.setSoTimeout((int) settings.readTimeout().toMillis());
    } catch (SocketException e) {
      log.debug("Could not configure connection from {}: {}", item.remoteAddress(), e.toString());
      item.closeWithoutDrain(watchdog);
      return;
    }
    switch (queue.offer(item)) {
      case ACCEPTED:
        break;
      case BUSY:
        log.warn("Rejecting connection from {}: dispatch queue is full", item.remoteAddress());
        reject(item, HttpStatus.SERVICE_UNAVAILABLE, BUSY_MESSAGE);
        break;
      case DISCONNECTED:
        log.warn("Rejecting connection from {}: no worker available", item.remoteAddress());
        reject(item, HttpStatus.INTERNAL_SERVER_ERROR, DISCONNECTED_MESSAGE);
        break;
      default:
        throw new IllegalStateException("Unexpected admission outcome");
    }
  }

  /** Runs on the accept thread, so it must never wait on the peer. */
  private void reject(ConnectionWorkItem item, HttpStatus status, String message) {
    try {
      item.respond(HttpResponse.text(status, message), watchdog);
    } catch (IOException e) {
      log.debug("Rejection to {} not delivered: {}", item.remoteAddress(), e.toString());
    } finally {
      item.closeWithoutDrain(watchdog);
    }
  }

  /** Stop accepting, let workers finish their current connection and exit. Idempotent. */
  public void stop() {
    synchronized (lifecycleLock) {
      if (listener == null) {
        return;
      }
      running = false;
      try {
        listener.close();
      } catch (IOException e) {
        log.warn("Failed to close listener", e);
      }
      try {
        workers.stop(WORKER_STOP_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException e) {
        log.error("Error stopping workers: {}", ExceptionUtil.extractErrorMessage(e), e);
      }
      List<ConnectionWorkItem> leftovers = queue.drain();
      for (ConnectionWorkItem item : leftovers) {
        log.debug(
            "Answering {} queued for {} ms with 503", item.remoteAddress(), item.ageMillis());
        try {
          item.respond(HttpResponse.text(HttpStatus.SERVICE_UNAVAILABLE, BUSY_MESSAGE), watchdog);
        } catch (IOException e) {
          log.debug("Shutdown reply to {} not delivered: {}", item.remoteAddress(), e.toString());
        } finally {
          item.close();
        }
      }
      watchdog.close();
      listener = null;
      log.info("Server stopped");
    }
  }

  public void join() throws InterruptedException {
    Thread t;
    synchronized (lifecycleLock) {
      t = acceptThread;
    }
    if (t != null) {
      t.join();
    }
  }

  int queuedConnections() {
    synchronized (lifecycleLock) {
      return queue == null ? 0 : queue.size();
    }
  }

  public boolean isRunning() {
    return running;
  }

  /** The bound port, which differs from the configured one when that was 0. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (listener != null) {
        return listener.getLocalPort();
      }
      return settings.port();
    }
  }

  @Override
  public void close() {
    stop();
  }
}
