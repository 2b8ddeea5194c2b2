package com.gentoro.tldr.summary;

/** What the generated text should look like. */
public enum SummaryMode {
  /** Debate-ready Markdown summary. */
  SUMMARY("prompts/summary-system.md"),
  /** Narration script retelling the video. */
  SCRIPT("prompts/script-system.md");

  private final String promptResource;

  SummaryMode(String promptResource) {
    this.promptResource = promptResource;
  }

  String promptResource() {
    return promptResource;
  }
}
