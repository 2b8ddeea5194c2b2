package com.gentoro.tldr.summary;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload returned synchronously and stored as the result of finished jobs. */
public record SummaryResult(
    @JsonProperty("summary") String summary,
    @JsonProperty("subtitles") String subtitles,
    @JsonProperty("video_name") String videoName) {}
