package com.gentoro.tldr.http;

/** Produces the single response for a routed request. */
@FunctionalInterface
public interface RouteHandler {
  HttpResponse handle(HttpRequest request);
}
