package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of classifying a prompt, with the signals that produced the score.
 */
@Value
@Builder
public class ComplexityAnalysis {
    int score;
    ComplexityClass complexity;
    int wordCount;
    boolean hasCode;
    boolean hasNonLatinScript;
}
