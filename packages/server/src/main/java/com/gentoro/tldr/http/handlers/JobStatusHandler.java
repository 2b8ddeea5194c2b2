package com.gentoro.tldr.http.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tldr.exception.BadRequestException;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.HttpStatus;
import com.gentoro.tldr.http.RouteHandler;
import com.gentoro.tldr.jobs.JobManager;
import com.gentoro.tldr.jobs.JobState;
import java.util.Map;
import java.util.Optional;

/**
 * {@code GET /api/job?id=...} (or {@code job_id=...}). Answers the current state as
 * {@code {"status":"pending"}}, {@code {"status":"done","result":...}} or
 * {@code {"status":"error","error":"..."}}; unknown ids get 404 with {@code "error":"not_found"}.
 */
public final class JobStatusHandler implements RouteHandler {
  static final String NOT_FOUND = "not_found";

  private final JobManager jobs;
  private final ObjectMapper mapper;

  public JobStatusHandler(JobManager jobs, ObjectMapper mapper) {
    this.jobs = jobs;
    this.mapper = mapper;
  }

  @Override
  public HttpResponse handle(HttpRequest request) {
    String id = jobId(request.queryParameters());
    Optional<JobState> state = jobs.status(id);
    if (state.isEmpty()) {
      return JsonBodies.write(mapper, HttpStatus.NOT_FOUND, error(NOT_FOUND));
    }
    return JsonBodies.ok(mapper, toJson(state.get()));
  }

  ObjectNode toJson(JobState state) {
    if (state instanceof JobState.Done done) {
      ObjectNode node = mapper.createObjectNode();
      node.put("status", "done");
      node.set("result", mapper.valueToTree(done.result()));
      return node;
    }
    if (state instanceof JobState.Error failed) {
      return error(failed.message());
    }
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "pending");
    return node;
  }

  private ObjectNode error(String message) {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "error");
    node.put("error", message);
    return node;
  }

  private static String jobId(Map<String, String> params) {
    String id = params.get("id");
    if (id == null || id.isBlank()) {
      id = params.get("job_id");
    }
    if (id == null || id.isBlank()) {
      throw new BadRequestException("Missing job id: use ?id=<job id>");
    }
    return id.trim();
  }
}
