package com.gentoro.tldr.llm;

/**
 * Result of a single backend turn.
 *
 * @param text generated text of this turn
 * @param truncated whether generation stopped because of a length limit
 */
public record Completion(String text, boolean truncated) {}
