package ru.javaboys.huntysourcing.engine.verify;

/**
 * Strongest evidence that tied a search result to the target company.
 */
public enum CompanyEvidence {
    EXACT,
    LOOSE,
    MENTION,
    SNIPPET,
    NONE
}
