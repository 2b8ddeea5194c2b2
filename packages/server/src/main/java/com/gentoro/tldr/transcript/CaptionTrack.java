package com.gentoro.tldr.transcript;

import java.util.List;
import java.util.Optional;

/** A caption track advertised by the player endpoint. */
record CaptionTrack(String baseUrl, String languageCode) {

  boolean isAutoGenerated() {
    return baseUrl.contains("kind=asr");
  }

  boolean isPunctuated() {
    return baseUrl.contains("variant=punctuated");
  }

  /**
   * Pick the best track for a language: a manually authored one first, then punctuated
   * auto-generated, then plain auto-generated.
   */
  static Optional<CaptionTrack> selectBest(List<CaptionTrack> tracks, String language) {
    CaptionTrack punctuated = null;
    CaptionTrack plain = null;
    for (CaptionTrack track : tracks) {
      if (!track.languageCode().equals(language)) {
        continue;
      }
      if (!track.isAutoGenerated()) {
        return Optional.of(track);
      }
      if (track.isPunctuated()) {
        if (punctuated == null) punctuated = track;
      } else if (plain == null) {
        plain = track;
      }
    }
    return Optional.ofNullable(punctuated != null ? punctuated : plain);
  }

  /** URL returning the track in the json3 caption format. */
  String json3Url() {
    return baseUrl.replace("\\u0026", "&") + "&fmt=json3";
  }
}
