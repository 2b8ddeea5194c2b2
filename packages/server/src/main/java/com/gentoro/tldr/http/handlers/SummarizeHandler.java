package com.gentoro.tldr.http.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.RouteHandler;
import com.gentoro.tldr.summary.SummaryRequest;
import com.gentoro.tldr.summary.SummaryResult;
import com.gentoro.tldr.summary.SummaryService;

/**
 * {@code POST /api/summarize}: does the whole job on the worker thread and answers with the
 * result. Collaborator failures propagate and become a 500 carrying their message.
 */
public final class SummarizeHandler implements RouteHandler {
  private final SummaryService summaries;
  private final ObjectMapper mapper;

  public SummarizeHandler(SummaryService summaries, ObjectMapper mapper) {
    this.summaries = summaries;
    this.mapper = mapper;
  }

  @Override
  public HttpResponse handle(HttpRequest request) {
    SummaryRequest body = JsonBodies.read(mapper, request, SummaryRequest.class);
    SummaryResult result = summaries.summarize(body);
    return JsonBodies.ok(mapper, result);
  }
}
