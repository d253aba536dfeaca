package ru.javaboys.huntysourcing.dto;

import lombok.Value;
import ru.javaboys.huntysourcing.engine.Candidate;

import java.util.List;

@Value
public class GeneratedContacts {
    List<Candidate> contacts;
    int queriesIssued;
    int skippedAsDuplicates;
}
