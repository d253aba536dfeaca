package ru.javaboys.huntysourcing.engine.score;

import lombok.Value;

import java.util.List;

@Value
public class FitScore {
    int score; // 0..100
    List<String> reasons;
    KeywordMatch keywordMatch;
}
