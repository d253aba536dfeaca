package ru.javaboys.huntysourcing.engine.company;

import lombok.Value;

@Value
public class DomainMatch {
    String domain;
    String directoryName; // ключ справочника, который сработал
    int score;            // 0..100
}
