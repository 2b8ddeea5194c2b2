package com.gentoro.tldr.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tldr.config.YouTubeSettings;
import com.gentoro.tldr.exception.TranscriptException;
import com.gentoro.tldr.exception.TranscriptException.Kind;
import com.gentoro.tldr.logging.LoggingService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * Fetches captions through the public InnerTube player endpoint.
 *
 * <p>The player response carries the video title and the list of caption tracks; the selected
 * track is then downloaded in the {@code json3} format and flattened into plain text.
 */
public class YouTubeTranscriptSource implements TranscriptSource {
  private static final Logger log = LoggingService.getLogger(YouTubeTranscriptSource.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
          + " Chrome/124.0.0.0 Safari/537.36";

  private final OkHttpClient client;
  private final YouTubeSettings settings;
  private final ObjectMapper mapper;

  public YouTubeTranscriptSource(OkHttpClient client, YouTubeSettings settings, ObjectMapper mapper) {
    this.client = client;
    this.settings = settings;
    this.mapper = mapper;
  }

  @Override
  public Transcript fetch(String reference, String language) {
    String videoId =
        VideoReferences.extractVideoId(reference)
            .orElseThrow(
                () ->
                    new TranscriptException(
                        Kind.INVALID_REFERENCE,
                        "Invalid or unsupported YouTube URL: " + reference));
    log.debug("Fetching transcript for video {} ({})", videoId, language);

    JsonNode player = fetchPlayer(videoId);
    JsonNode details = player.path("videoDetails");
    if (details.isMissingNode() || details.isNull()) {
      throw new TranscriptException(
          Kind.BLOCKED,
          "Video details not found in API response. Server IP likely blocked by YouTube.");
    }
    String title = details.path("title").asText("");

    JsonNode trackNodes =
        player.path("captions").path("playerCaptionsTracklistRenderer").path("captionTracks");
    if (!trackNodes.isArray()) {
      throw new TranscriptException(Kind.NO_CAPTIONS, "No captions found for video ID: " + videoId);
    }
    List<CaptionTrack> tracks = new ArrayList<>();
    for (JsonNode node : trackNodes) {
      tracks.add(
          new CaptionTrack(node.path("baseUrl").asText(""), node.path("languageCode").asText("")));
    }
    CaptionTrack track =
        CaptionTrack.selectBest(tracks, language)
            .orElseThrow(
                () ->
                    new TranscriptException(
                        Kind.NO_CAPTIONS,
                        "No suitable captions found for language '%s'".formatted(language)));

    return new Transcript(flatten(fetchCaptions(track)), title);
  }

  private JsonNode fetchPlayer(String videoId) {
    ObjectNode payload = mapper.createObjectNode();
    payload
        .putObject("context")
        .putObject("client")
        .put("clientName", "WEB")
        .put("clientVersion", settings.clientVersion());
    payload.put("videoId", videoId);

    Request request =
        new Request.Builder()
            .url(settings.baseUrl() + "/youtubei/v1/player?key=" + settings.apiKey())
            .header("User-Agent", USER_AGENT)
            .header("Referer", settings.baseUrl() + "/")
            .post(RequestBody.create(payload.toString(), JSON))
            .build();
    return executeForJson(request, "player data");
  }

  private JsonNode fetchCaptions(CaptionTrack track) {
    Request request =
        new Request.Builder().url(track.json3Url()).header("User-Agent", USER_AGENT).get().build();
    return executeForJson(request, "captions");
  }

  private JsonNode executeForJson(Request request, String what) {
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new TranscriptException(
            Kind.FETCH_FAILED, "Fetching %s failed with HTTP %d".formatted(what, response.code()));
      }
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new TranscriptException(Kind.FETCH_FAILED, "Failed to parse " + what + " JSON", e);
    } catch (IOException e) {
      throw new TranscriptException(
          Kind.FETCH_FAILED, "Fetching %s failed: %s".formatted(what, e.getMessage()), e);
    }
  }

  /** Joins the trimmed, non-blank segments of every caption event with single spaces. */
  static String flatten(JsonNode captions) {
    StringJoiner transcript = new StringJoiner(" ");
    for (JsonNode event : captions.path("events")) {
      JsonNode segments = event.path("segs");
      if (!segments.isArray()) {
        continue;
      }
      StringJoiner line = new StringJoiner(" ");
      for (JsonNode segment : segments) {
        String text = segment.path("utf8").asText("").trim();
        if (!text.isEmpty()) {
          line.add(text);
        }
      }
      if (line.length() > 0) {
        transcript.add(line.toString());
      }
    }
    return transcript.toString();
  }
}
