package ru.javaboys.huntysourcing.engine.score;

import lombok.Value;

@Value
public class KeywordMatch {

    public static final KeywordMatch NONE = new KeywordMatch("", "", 0, 0, false);

    String keyword;     // исходная фраза из набора
    String variant;     // вариант, который совпал
    int score;          // 0 | 65..85 | 100
    int overlap;
    boolean exactPhrase;

    public boolean isStrong() {
        return score >= 100;
    }

    public boolean isPartial() {
        return score >= 20 && score < 100;
    }
}
