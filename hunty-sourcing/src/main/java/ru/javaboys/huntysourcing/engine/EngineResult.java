package ru.javaboys.huntysourcing.engine;

import lombok.Value;

import java.util.List;

@Value
public class EngineResult {
    List<Candidate> candidates;
    int queriesIssued;

    public static EngineResult empty() {
        return new EngineResult(List.of(), 0);
    }
}
