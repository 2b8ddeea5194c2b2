package com.gentoro.tldr.transcript;

/** Resolves a video reference into its transcript. Calls may block for several seconds. */
public interface TranscriptSource {

  /**
   * @param reference a video URL or similar reference
   * @param language preferred caption language code, e.g. {@code en}
   * @throws com.gentoro.tldr.exception.TranscriptException on any domain failure
   */
  Transcript fetch(String reference, String language);
}
