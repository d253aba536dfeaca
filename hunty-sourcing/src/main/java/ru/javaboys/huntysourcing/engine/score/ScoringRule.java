package ru.javaboys.huntysourcing.engine.score;

import java.util.Optional;

/**
 * One weighted signal. Empty result means the rule does not fire.
 */
@FunctionalInterface
public interface ScoringRule {
    Optional<Adjustment> apply(ScoringContext ctx);
}
