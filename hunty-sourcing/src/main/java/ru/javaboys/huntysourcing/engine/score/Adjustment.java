package ru.javaboys.huntysourcing.engine.score;

import lombok.Value;

@Value
public class Adjustment {
    int delta;
    String reason;
}
