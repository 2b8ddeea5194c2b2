package com.gentoro.tldr.llm;

/**
 * Generation tunables passed to the backend on every turn.
 *
 * @param temperature sampling temperature
 * @param repeatPenalty penalty applied to repeated tokens
 * @param contextSize context window in tokens
 * @param maxTokensPerTurn upper bound of generated tokens in a single turn
 * @param maxContinuations how many extra turns may follow a truncated one
 */
public record CompletionOptions(
    double temperature,
    double repeatPenalty,
    int contextSize,
    int maxTokensPerTurn,
    int maxContinuations) {}
