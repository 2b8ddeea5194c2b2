package com.gentoro.tldr.http.handlers;

import com.gentoro.tldr.http.HttpRequest;
import com.gentoro.tldr.http.HttpResponse;
import com.gentoro.tldr.http.RouteHandler;

/** Serves one precompressed asset. */
public final class StaticAssetHandler implements RouteHandler {
  private final HttpResponse asset;

  public StaticAssetHandler(HttpResponse asset) {
    this.asset = asset;
  }

  @Override
  public HttpResponse handle(HttpRequest request) {
    return asset;
  }
}
