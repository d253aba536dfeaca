package ru.javaboys.huntysourcing.engine.company;

import lombok.Getter;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable lookup data for company-name normalization.
 * Suffixes are kept longest first so that "capital management" wins over "management".
 */
@Getter
public final class CompanyNameRules {

    private final List<String> suffixes;
    private final Set<String> noTruncate;
    private final Set<String> genericTokens;

    public CompanyNameRules(List<String> suffixes, Set<String> noTruncate, Set<String> genericTokens) {
        this.suffixes = suffixes.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toUnmodifiableList());
        this.noTruncate = Set.copyOf(noTruncate);
        this.genericTokens = Set.copyOf(genericTokens);
    }

    public static CompanyNameRules defaults() {
        return new CompanyNameRules(
                List.of(
                        "asset management", "capital management", "investment management", "wealth management",
                        "global advisors", "global investors", "investment partners", "capital markets",
                        "securities", "investments", "advisors", "group", "holdings", "partners",
                        "and co", "and company", "llc", "llp", "lp", "inc", "corp", "corporation",
                        "ltd", "limited", "plc", "ag", "sa", "co"
                ),
                Set.of("capital group", "man group", "carlyle group", "blackstone group", "two sigma investments",
                        "partners group", "global atlantic"),
                Set.of("inc", "corp", "corporation", "company", "co", "llc", "llp", "lp", "ltd", "limited", "plc",
                        "ag", "sa", "holdings", "holding", "group", "partners", "the", "and", "of", "capital",
                        "management", "global", "advisors", "investments", "international", "financial",
                        "services", "securities", "asset", "wealth", "markets")
        );
    }

    public boolean isGeneric(String token) {
        return genericTokens.contains(token);
    }
}
