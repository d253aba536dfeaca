package ru.javaboys.huntysourcing.engine.quota;

import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable per-level weights for slot apportionment.
 */
public final class SeniorityWeights {

    private final Map<SeniorityLevel, Integer> weights;

    public SeniorityWeights(Map<SeniorityLevel, Integer> weights) {
        EnumMap<SeniorityLevel, Integer> copy = new EnumMap<>(SeniorityLevel.class);
        weights.forEach((level, w) -> {
            if (w == null || w <= 0) {
                throw new IllegalArgumentException("Weight must be positive for " + level + ": " + w);
            }
            copy.put(level, w);
        });
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static SeniorityWeights defaults() {
        EnumMap<SeniorityLevel, Integer> m = new EnumMap<>(SeniorityLevel.class);
        m.put(SeniorityLevel.ANALYST, 6);
        m.put(SeniorityLevel.ASSOCIATE, 3);
        m.put(SeniorityLevel.VP, 2);
        m.put(SeniorityLevel.DIRECTOR, 1);
        m.put(SeniorityLevel.EXECUTIVE_DIRECTOR, 1);
        m.put(SeniorityLevel.MANAGING_DIRECTOR, 1);
        return new SeniorityWeights(m);
    }

    public int weightOf(SeniorityLevel level) {
        return weights.getOrDefault(level, 1);
    }
}
