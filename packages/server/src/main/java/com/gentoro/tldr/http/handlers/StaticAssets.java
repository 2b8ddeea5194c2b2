package com.gentoro.tldr.http.handlers;

import com.gentoro.tldr.exception.StateException;
import com.gentoro.tldr.http.HttpResponse;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

/** Web UI files, read from the classpath once and kept gzip-compressed in memory. */
public final class StaticAssets {
  static final String RESOURCE_ROOT = "static/";

  private final Map<String, HttpResponse> assets;

  private StaticAssets(Map<String, HttpResponse> assets) {
    this.assets = Map.copyOf(assets);
  }

  /** Load {@code index.html}, {@code style.css} and {@code script.js}. */
  public static StaticAssets loadDefaults() {
    Map<String, HttpResponse> assets = new LinkedHashMap<>();
    HttpResponse index = load("index.html", "text/html; charset=utf-8");
    assets.put("/", index);
    assets.put("/index.html", index);
    assets.put("/style.css", load("style.css", "text/css; charset=utf-8"));
    assets.put("/script.js", load("script.js", "application/javascript; charset=utf-8"));
    return new StaticAssets(assets);
  }

  public Map<String, HttpResponse> byPath() {
    return assets;
  }

  private static HttpResponse load(String name, String contentType) {
    String resource = RESOURCE_ROOT + name;
    try (InputStream in = StaticAssets.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new StateException("Missing static resource: " + resource);
      }
      return HttpResponse.gzipped(contentType, gzip(in.readAllBytes()));
    } catch (IOException e) {
      throw new StateException("Failed to load static resource: " + resource, e);
    }
  }

  static byte[] gzip(byte[] raw) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(raw.length / 2 + 64);
    try (GZIPOutputStream gz = new GZIPOutputStream(buffer)) {
      gz.write(raw);
    }
    return buffer.toByteArray();
  }
}
