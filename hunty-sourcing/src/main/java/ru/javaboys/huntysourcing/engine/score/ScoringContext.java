package ru.javaboys.huntysourcing.engine.score;

import lombok.Value;

/**
 * Scoring input plus values derived once per candidate.
 */
@Value
public class ScoringContext {
    ScoringInput input;
    KeywordMatch keywordMatch;
}
