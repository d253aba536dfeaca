package ru.javaboys.huntysourcing.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EngineSettings {
    @Builder.Default
    int gatherMultiplier = 6;
    @Builder.Default
    int maxKeywords = 8;
    @Builder.Default
    String defaultKeyword = "Investment Banking";
    @Builder.Default
    PrecisionMode precisionMode = PrecisionMode.SEARCH;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
