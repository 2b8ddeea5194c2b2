package com.gentoro.tldr;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tldr.client.OkHttpFactory;
import com.gentoro.tldr.config.ConfigurationProvider;
import com.gentoro.tldr.config.JobSettings;
import com.gentoro.tldr.config.OllamaSettings;
import com.gentoro.tldr.config.ServerSettings;
import com.gentoro.tldr.config.YouTubeSettings;
import com.gentoro.tldr.exception.ExceptionUtil;
import com.gentoro.tldr.exception.StateException;
import com.gentoro.tldr.http.Router;
import com.gentoro.tldr.http.TldrHttpServer;
import com.gentoro.tldr.http.handlers.JobStatusHandler;
import com.gentoro.tldr.http.handlers.ModelsHandler;
import com.gentoro.tldr.http.handlers.StaticAssetHandler;
import com.gentoro.tldr.http.handlers.StaticAssets;
import com.gentoro.tldr.http.handlers.SubmitHandler;
import com.gentoro.tldr.http.handlers.SummarizeHandler;
import com.gentoro.tldr.jobs.DefaultJobIdGenerator;
import com.gentoro.tldr.jobs.InMemoryJobRegistry;
import com.gentoro.tldr.jobs.JobManager;
import com.gentoro.tldr.llm.CompletionAccumulator;
import com.gentoro.tldr.llm.CompletionBackend;
import com.gentoro.tldr.llm.OllamaCompletionBackend;
import com.gentoro.tldr.logging.LoggingService;
import com.gentoro.tldr.summary.PromptLibrary;
import com.gentoro.tldr.summary.SummaryMode;
import com.gentoro.tldr.summary.SummaryService;
import com.gentoro.tldr.transcript.TranscriptSource;
import com.gentoro.tldr.transcript.YouTubeTranscriptSource;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Composition root: builds every component from configuration and owns their lifecycle. */
public class Tldr {
  private static final Logger log = LoggingService.getLogger(Tldr.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private JobManager jobManager;
  private TldrHttpServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public Tldr(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    ServerSettings serverSettings = ServerSettings.from(configuration());
    OllamaSettings ollamaSettings = OllamaSettings.from(configuration());
    YouTubeSettings youTubeSettings = YouTubeSettings.from(configuration());
    JobSettings jobSettings = JobSettings.from(configuration());

    ObjectMapper mapper = new ObjectMapper();
    OkHttpClient http = OkHttpFactory.create(Duration.ofSeconds(30));

    CompletionBackend backend = new OllamaCompletionBackend(http, ollamaSettings, mapper);
    TranscriptSource transcripts = new YouTubeTranscriptSource(http, youTubeSettings, mapper);
    SummaryService summaries =
        new SummaryService(
            transcripts,
            new CompletionAccumulator(backend, ollamaSettings.options()),
            PromptLibrary.loadDefaults(),
            ollamaSettings.defaultModel(),
            youTubeSettings.defaultLanguage());

    this.jobManager =
        new JobManager(new InMemoryJobRegistry(), new DefaultJobIdGenerator(), jobSettings);
    Router router = routes(StaticAssets.loadDefaults(), backend, summaries, jobManager, mapper);

    this.httpServer = new TldrHttpServer(serverSettings, router);
    try {
      httpServer.prepare();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new StateException("Could not start http server", ex));
    }
    log.info(
        "Using Ollama at {} (default model {}, call timeout {})",
        ollamaSettings.baseUrl(),
        ollamaSettings.defaultModel(),
        ollamaSettings.callTimeout().isZero() ? "unbounded" : ollamaSettings.callTimeout());
  }

  static Router routes(
      StaticAssets assets,
      CompletionBackend backend,
      SummaryService summaries,
      JobManager jobs,
      ObjectMapper mapper) {
    Router.Builder builder = Router.builder();
    assets.byPath().forEach((path, asset) -> builder.get(path, new StaticAssetHandler(asset)));
    return builder
        .get("/api/models", new ModelsHandler(backend, mapper))
        .get("/api/job", new JobStatusHandler(jobs, mapper))
        .post("/api/summarize", new SummarizeHandler(summaries, mapper))
        .post("/api/submit", new SubmitHandler(jobs, summaries, SummaryMode.SUMMARY, mapper))
        .post(
            "/api/submit_script", new SubmitHandler(jobs, summaries, SummaryMode.SCRIPT, mapper))
        .build();
  }

  /**
   * Block until the JVM is asked to terminate (e.g. Ctrl+C), then release resources via {@link
   * #shutdown()}.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "tldr-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(httpServer);
        closeQuietly(jobManager);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while closing {}: {}", closeable.getClass().getSimpleName(), e.toString());
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Tldr not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public TldrHttpServer httpServer() {
    return httpServer;
  }
}
