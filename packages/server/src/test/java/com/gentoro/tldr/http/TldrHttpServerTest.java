package com.gentoro.tldr.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tldr.config.ServerSettings;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TldrHttpServerTest {

  private final CountDownLatch release = new CountDownLatch(1);
  private final CountDownLatch entered = new CountDownLatch(1);
  private TldrHttpServer server;

  private final Router router =
      Router.builder()
          .get("/fast", req -> HttpResponse.text(HttpStatus.OK, "fast"))
          .get(
              "/slow",
              req -> {
                entered.countDown();
                try {
                  release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
                return HttpResponse.text(HttpStatus.OK, "slow");
              })
          .get(
              "/boom",
              req -> {
                throw new IllegalStateException("kaboom");
              })
          .get(
              "/fatal",
              req -> {
                throw new AssertionError("worker lost");
              })
          .get(
              "/fatal-after-release",
              req -> {
                entered.countDown();
                try {
                  release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
                throw new AssertionError("worker lost");
              })
          .post("/echo", req -> HttpResponse.json(HttpStatus.OK, req.bodyAsString()))
          .build();

  private static ServerSettings settings(int workers, int queueCapacity) {
    return new ServerSettings(
        "127.0.0.1", 0, workers, queueCapacity, 1024, 1024, Duration.ofSeconds(2), Duration.ofSeconds(2));
  }

  private int start(int workers, int queueCapacity) {
    server = new TldrHttpServer(settings(workers, queueCapacity), router);
    server.prepare();
    server.start();
    return server.getPort();
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    if (server != null) {
      server.stop();
    }
  }

  private static void await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not met within " + timeout);
      }
      Thread.sleep(10);
    }
  }

  @Test
  @DisplayName("Every response carries length, type and connection close")
  void wellFormedResponse() throws IOException {
    int port = start(2, 4);
    RawHttpClient.Response response = RawHttpClient.get(port, "/fast");

    assertEquals(200, response.status());
    assertEquals("fast", response.bodyAsString());
    assertEquals("4", response.header("Content-Length"));
    assertEquals("close", response.header("Connection"));
    assertTrue(response.header("Content-Type").startsWith("text/plain"));
  }

  @Test
  @DisplayName("Unknown routes answer 404")
  void notFound() throws IOException {
    int port = start(1, 1);
    assertEquals(404, RawHttpClient.get(port, "/missing").status());
  }

  @Test
  @DisplayName("Handler failures become 500 with the error text and the worker keeps serving")
  void workerFailure() throws IOException {
    int port = start(1, 2);
    RawHttpClient.Response failed = RawHttpClient.get(port, "/boom");
    assertEquals(500, failed.status());
    assertTrue(failed.bodyAsString().contains("kaboom"));

    assertEquals(200, RawHttpClient.get(port, "/fast").status());
  }

  @Test
  @DisplayName("Body over the limit answers 413")
  void bodyTooLarge() throws IOException {
    int port = start(1, 1);
    try (RawHttpClient client = new RawHttpClient(port)) {
      client.send("POST /echo HTTP/1.1\r\nContent-Length: 5000\r\n\r\n");
      assertEquals(413, client.readResponse().status());
    }
  }

  @Test
  @DisplayName("Posted body is read exactly")
  void echo() throws IOException {
    int port = start(1, 1);
    RawHttpClient.Response response = RawHttpClient.postJson(port, "/echo", "{\"a\":1}");
    assertEquals(200, response.status());
    assertEquals("{\"a\":1}", response.bodyAsString());
  }

  @Test
  @DisplayName("With the worker busy and the queue full the next connection gets 503")
  void busyWhenSaturated() throws Exception {
    int port = start(1, 1);
    ExecutorService clients = Executors.newFixedThreadPool(2);
    try {
      Future<RawHttpClient.Response> first = clients.submit(() -> RawHttpClient.get(port, "/slow"));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      Future<RawHttpClient.Response> second = clients.submit(() -> RawHttpClient.get(port, "/fast"));
      await(() -> server.queuedConnections() == 1, Duration.ofSeconds(5));

      RawHttpClient.Response rejected = RawHttpClient.get(port, "/fast");
      assertEquals(503, rejected.status());
      assertEquals(TldrHttpServer.BUSY_MESSAGE, rejected.bodyAsString());

      release.countDown();
      assertEquals("slow", first.get(5, TimeUnit.SECONDS).bodyAsString());
      assertEquals("fast", second.get(5, TimeUnit.SECONDS).bodyAsString());
    } finally {
      clients.shutdownNow();
    }
  }

  @Test
  @DisplayName("Up to queue capacity concurrent slow requests all succeed")
  void withinCapacityAllSucceed() throws Exception {
    int port = start(2, 4);
    ExecutorService clients = Executors.newFixedThreadPool(6);
    try {
      List<Future<RawHttpClient.Response>> futures = new ArrayList<>();
      futures.add(clients.submit(() -> RawHttpClient.get(port, "/slow")));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      for (int i = 0; i < 4; i++) {
        futures.add(clients.submit(() -> RawHttpClient.get(port, "/fast")));
      }
      release.countDown();
      for (Future<RawHttpClient.Response> f : futures) {
        assertEquals(200, f.get(5, TimeUnit.SECONDS).status());
      }
    } finally {
      clients.shutdownNow();
    }
  }

  @Test
  @DisplayName("stop is idempotent and releases the port")
  void stopIsIdempotent() throws Exception {
    start(1, 1);
    server.stop();
    server.stop();
    assertFalse(server.isRunning());
    server.join();
  }

  @Test
  @DisplayName("A rejected peer that keeps trickling bytes does not delay the next rejection")
  void tricklingRejectedPeerDoesNotStallAccept() throws Exception {
    int port = start(1, 1);
    ExecutorService clients = Executors.newFixedThreadPool(3);
    try {
      clients.submit(() -> RawHttpClient.get(port, "/slow"));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      clients.submit(() -> RawHttpClient.get(port, "/fast"));
      await(() -> server.queuedConnections() == 1, Duration.ofSeconds(5));

      Future<?> trickler =
          clients.submit(
              () -> {
                try (Socket socket = new Socket("127.0.0.1", port)) {
                  OutputStream out = socket.getOutputStream();
                  long end = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
                  while (System.nanoTime() < end) {
                    out.write('x');
                    out.flush();
                    Thread.sleep(100);
                  }
                } catch (IOException e) {
                  // the server closed the rejected connection, which is the expected outcome
                }
                return null;
              });
      Thread.sleep(300);

      long started = System.nanoTime();
      RawHttpClient.Response rejected = RawHttpClient.get(port, "/fast");
      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

      assertEquals(503, rejected.status());
      assertEquals(TldrHttpServer.BUSY_MESSAGE, rejected.bodyAsString());
      assertTrue(elapsedMillis < 1000, "503 took " + elapsedMillis + " ms");
      trickler.get(5, TimeUnit.SECONDS);
    } finally {
      release.countDown();
      clients.shutdownNow();
    }
  }

  @Test
  @DisplayName("A failing accept does not stop the accept loop")
  void acceptFailureIsNotFatal() throws IOException {
    AtomicInteger failuresLeft = new AtomicInteger(2);
    server =
        new TldrHttpServer(settings(1, 1), router) {
          @Override
          ServerSocket openListener() throws IOException {
            return new ServerSocket() {
              @Override
              public Socket accept() throws IOException {
                if (failuresLeft.getAndDecrement() > 0) {
                  throw new SocketException("Too many open files");
                }
                return super.accept();
              }
            };
          }
        };
    server.prepare();
    server.start();

    RawHttpClient.Response response = RawHttpClient.get(server.getPort(), "/fast");

    assertEquals(200, response.status());
    assertTrue(failuresLeft.get() < 0);
    assertTrue(server.isRunning());
  }

  @Test
  @DisplayName("A worker dying with an Error still answers 500, then the pool reports disconnected")
  void workerDeathAnswersAndDisconnects() throws Exception {
    int port = start(1, 2);

    RawHttpClient.Response crashed = RawHttpClient.get(port, "/fatal");
    assertEquals(500, crashed.status());
    assertTrue(crashed.bodyAsString().contains("worker lost"));

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    RawHttpClient.Response next;
    do {
      next = RawHttpClient.get(port, "/fast");
    } while (next.status() == 200 && System.nanoTime() < deadline);

    assertEquals(500, next.status());
    assertEquals(TldrHttpServer.DISCONNECTED_MESSAGE, next.bodyAsString());
  }

  @Test
  @DisplayName("Connections queued behind the last dying worker are answered with 500")
  void queuedConnectionsAnsweredWhenPoolDies() throws Exception {
    int port = start(1, 2);
    ExecutorService clients = Executors.newFixedThreadPool(2);
    try {
      Future<RawHttpClient.Response> crashing =
          clients.submit(() -> RawHttpClient.get(port, "/fatal-after-release"));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      Future<RawHttpClient.Response> queued =
          clients.submit(() -> RawHttpClient.get(port, "/fast"));
      await(() -> server.queuedConnections() == 1, Duration.ofSeconds(5));

      release.countDown();

      assertEquals(500, crashing.get(5, TimeUnit.SECONDS).status());
      RawHttpClient.Response stranded = queued.get(5, TimeUnit.SECONDS);
      assertEquals(500, stranded.status());
      assertEquals(TldrHttpServer.DISCONNECTED_MESSAGE, stranded.bodyAsString());
      assertTrue(server.isRunning());
    } finally {
      clients.shutdownNow();
    }
  }
}
