package com.gentoro.tldr.http.handlers;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tldr.exception.BadRequestException;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.HttpStatus;
import com.gentoro.tldr.jobs.JobManager;
import com.gentoro.tldr.jobs.JobState;
import com.gentoro.tldr.summary.SummaryResult;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobStatusHandlerTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final JobManager jobs = mock(JobManager.class);
  private final JobStatusHandler handler = new JobStatusHandler(jobs, mapper);

  private JsonNode poll(String target, HttpStatus expected) throws Exception {
    HttpResponse response = handler.handle(HttpRequest.of("GET", target, new byte[0]));
    assertEquals(expected, response.status());
    assertEquals(HttpResponse.JSON, response.contentType());
    return mapper.readTree(response.body());
  }

  @Test
  @DisplayName("Pending jobs report only their status")
  void pending() throws Exception {
    when(jobs.status("j1")).thenReturn(Optional.of(JobState.PENDING));
    assertEquals("{\"status\":\"pending\"}", poll("/api/job?id=j1", HttpStatus.OK).toString());
  }

  @Test
  @DisplayName("Done jobs embed the result payload")
  void done() throws Exception {
    when(jobs.status("j1"))
        .thenReturn(Optional.of(new JobState.Done(new SummaryResult("sum", "subs", "name"))));

    JsonNode body = poll("/api/job?job_id=j1", HttpStatus.OK);

    assertEquals("done", body.get("status").asText());
    assertEquals("sum", body.at("/result/summary").asText());
    assertEquals("name", body.at("/result/video_name").asText());
  }

  @Test
  @DisplayName("Failed jobs carry the error text")
  void error() throws Exception {
    when(jobs.status("j1")).thenReturn(Optional.of(new JobState.Error("Ollama error: boom")));
    JsonNode body = poll("/api/job?id=j1", HttpStatus.OK);
    assertEquals("error", body.get("status").asText());
    assertEquals("Ollama error: boom", body.get("error").asText());
  }

  @Test
  @DisplayName("Unknown ids answer 404 with not_found")
  void unknown() throws Exception {
    when(jobs.status("nope")).thenReturn(Optional.empty());
    assertEquals(
        "{\"status\":\"error\",\"error\":\"not_found\"}",
        poll("/api/job?id=nope", HttpStatus.NOT_FOUND).toString());
  }

  @Test
  @DisplayName("Missing id is a bad request")
  void missingId() {
    assertThrows(
        BadRequestException.class,
        () -> handler.handle(HttpRequest.of("GET", "/api/job", new byte[0])));
    assertThrows(
        BadRequestException.class,
        () -> handler.handle(HttpRequest.of("GET", "/api/job?id=", new byte[0])));
  }
}
