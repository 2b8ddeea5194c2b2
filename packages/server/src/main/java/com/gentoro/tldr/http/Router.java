package com.gentoro.tldr.http;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Exact-match routing on method and path. The query string is never part of the match. Requests
 * with no matching route, including a known path with another method, get 404.
 */
public final class Router {
  static final String NOT_FOUND = "Not Found";

  private final Map<String, RouteHandler> routes;

  private Router(Map<String, RouteHandler> routes) {
    this.routes = Map.copyOf(routes);
  }

  public static Builder builder() {
    return new Builder();
  }

  public HttpResponse route(HttpRequest request) {
    RouteHandler handler = routes.get(key(request.method(), request.path()));
    if (handler == null) {
      return HttpResponse.text(HttpStatus.NOT_FOUND, NOT_FOUND);
    }
    return handler.handle(request);
  }

  /** Registered routes as {@code "METHOD path"} strings. */
  public Set<String> routes() {
    return routes.keySet();
  }

  private static String key(String method, String path) {
    return method + " " + path;
  }

  public static final class Builder {
    private final Map<String, RouteHandler> routes = new LinkedHashMap<>();

    public Builder get(String path, RouteHandler handler) {
      return add("GET", path, handler);
    }

    public Builder post(String path, RouteHandler handler) {
      return add("POST", path, handler);
    }

    public Builder add(String method, String path, RouteHandler handler) {
      if (routes.putIfAbsent(key(method, path), handler) != null) {
        throw new IllegalArgumentException("Duplicate route: " + key(method, path));
      }
      return this;
    }

    public Router build() {
      return new Router(routes);
    }
  }
}
