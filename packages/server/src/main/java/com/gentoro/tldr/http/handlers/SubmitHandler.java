package com.gentoro.tldr.http.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.RouteHandler;
import com.gentoro.tldr.jobs.JobManager;
import com.gentoro.tldr.summary.SummaryMode;
import com.gentoro.tldr.summary.SummaryRequest;
import com.gentoro.tldr.summary.SummaryService;

/**
 * {@code POST /api/submit} and {@code /api/submit_script}: hands the work to the job manager and
 * answers {@code {"job_id":"..."}} right away. The id is already pollable when it is returned.
 */
public final class SubmitHandler implements RouteHandler {
  private final JobManager jobs;
  private final SummaryService summaries;
  private final SummaryMode mode;
  private final ObjectMapper mapper;

  public SubmitHandler(
      JobManager jobs, SummaryService summaries, SummaryMode mode, ObjectMapper mapper) {
    this.jobs = jobs;
    this.summaries = summaries;
    this.mode = mode;
    this.mapper = mapper;
  }

  @Override
  public HttpResponse handle(HttpRequest request) {
    SummaryRequest body = JsonBodies.read(mapper, request, SummaryRequest.class);
    String id = jobs.submit(mode.name().toLowerCase(), () -> summaries.run(body, mode));
    ObjectNode payload = mapper.createObjectNode();
    payload.put("job_id", id);
    return JsonBodies.ok(mapper, payload);
  }
}
