package com.gentoro.tldr.transcript;

import java.util.List;
import java.util.Optional;

/** Extracts YouTube video ids from the reference shapes users paste. */
public final class VideoReferences {
  private static final int VIDEO_ID_LENGTH = 11;
  private static final List<String> MARKERS =
      List.of("v=", "/embed/", "/v/", "/shorts/", "youtu.be/");

  private VideoReferences() {}

  /** The first marker found wins; the id is the (up to) 11 characters that follow it. */
  public static Optional<String> extractVideoId(String reference) {
    if (reference == null) {
      return Optional.empty();
    }
    for (String marker : MARKERS) {
      int index = reference.indexOf(marker);
      if (index < 0) {
        continue;
      }
      String after = reference.substring(index + marker.length());
      String id = after.codePointCount(0, after.length()) <= VIDEO_ID_LENGTH
          ? after
          : after.substring(0, after.offsetByCodePoints(0, VIDEO_ID_LENGTH));
      return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }
    return Optional.empty();
  }
}
