package com.gentoro.tldr.transcript;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tldr.client.OkHttpFactory;
import com.gentoro.tldr.config.YouTubeSettings;
import com.gentoro.tldr.exception.TranscriptException;
import java.io.IOException;
import java.time.Duration;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class YouTubeTranscriptSourceTest {

  private static final String VIDEO = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
  private static final String CAPTIONS =
      "{\"events\":["
          + "{\"segs\":[{\"utf8\":\"Hello\"},{\"utf8\":\" world \"}]},"
          + "{\"tStartMs\":10},"
          + "{\"segs\":[{\"utf8\":\"\\n\"}]},"
          + "{\"segs\":[{\"utf8\":\"again\"}]}]}";

  private final ObjectMapper mapper = new ObjectMapper();
  private MockWebServer server;
  private YouTubeTranscriptSource source;
  private String playerBody;
  private int playerStatus = 200;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.setDispatcher(
        new Dispatcher() {
          @Override
          public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath();
            if (path.startsWith("/youtubei/v1/player")) {
              return new MockResponse().setResponseCode(playerStatus).setBody(playerBody);
            }
            if (path.startsWith("/api/timedtext") && path.contains("fmt=json3")) {
              return new MockResponse().setBody(CAPTIONS);
            }
            return new MockResponse().setResponseCode(404);
          }
        });
    server.start();
    String base = server.url("/").toString();
    YouTubeSettings settings =
        new YouTubeSettings(base.substring(0, base.length() - 1), "test-key", "2.0", "en");
    source = new YouTubeTranscriptSource(OkHttpFactory.create(Duration.ofSeconds(5)), settings, mapper);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private String track(String query, String language) {
    return "{\"baseUrl\":\"%s\",\"languageCode\":\"%s\"}"
        .formatted(server.url("/api/timedtext?" + query), language);
  }

  private void player(String tracksJson) {
    playerBody =
        "{\"videoDetails\":{\"title\":\"Never Gonna\"},"
            + "\"captions\":{\"playerCaptionsTracklistRenderer\":{\"captionTracks\":"
            + tracksJson
            + "}}}";
  }

  @Test
  @DisplayName("Fetches the best track and flattens it into one line of text")
  void fetchesTranscript() throws Exception {
    player("[" + track("v=x&kind=asr&lang=en", "en") + "," + track("v=x&lang=en", "en") + "]");

    Transcript transcript = source.fetch(VIDEO, "en");

    assertEquals("Never Gonna", transcript.title());
    assertEquals("Hello world again", transcript.text());

    RecordedRequest playerCall = server.takeRequest();
    assertEquals("/youtubei/v1/player?key=test-key", playerCall.getPath());
    JsonNode payload = mapper.readTree(playerCall.getBody().readUtf8());
    assertEquals("dQw4w9WgXcQ", payload.get("videoId").asText());
    assertEquals("WEB", payload.at("/context/client/clientName").asText());

    String captionPath = server.takeRequest().getPath();
    assertFalse(captionPath.contains("kind=asr"));
  }

  @Test
  @DisplayName("Unsupported references fail before any request is made")
  void invalidReference() {
    TranscriptException e =
        assertThrows(TranscriptException.class, () -> source.fetch("not a url", "en"));
    assertEquals(TranscriptException.Kind.INVALID_REFERENCE, e.kind());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  @DisplayName("Missing video details means the server is blocked")
  void blocked() {
    playerBody = "{\"playabilityStatus\":{\"status\":\"LOGIN_REQUIRED\"}}";
    TranscriptException e = assertThrows(TranscriptException.class, () -> source.fetch(VIDEO, "en"));
    assertEquals(TranscriptException.Kind.BLOCKED, e.kind());
  }

  @Test
  @DisplayName("No caption tracks or none in the language means no captions")
  void noCaptions() {
    playerBody = "{\"videoDetails\":{\"title\":\"t\"}}";
    assertEquals(
        TranscriptException.Kind.NO_CAPTIONS,
        assertThrows(TranscriptException.class, () -> source.fetch(VIDEO, "en")).kind());

    player("[" + track("v=x&lang=de", "de") + "]");
    assertEquals(
        TranscriptException.Kind.NO_CAPTIONS,
        assertThrows(TranscriptException.class, () -> source.fetch(VIDEO, "en")).kind());
  }

  @Test
  @DisplayName("HTTP failures are reported as fetch failures")
  void fetchFailed() {
    playerStatus = 500;
    playerBody = "oops";
    TranscriptException e = assertThrows(TranscriptException.class, () -> source.fetch(VIDEO, "en"));
    assertEquals(TranscriptException.Kind.FETCH_FAILED, e.kind());
  }
}
