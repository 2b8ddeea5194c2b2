package com.gentoro.tldr.transcript;

/**
 * Full caption text of a video plus its display name.
 *
 * @param text caption segments joined with single spaces
 * @param title human readable video title
 */
public record Transcript(String text, String title) {}
