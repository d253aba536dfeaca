package ru.javaboys.huntysourcing.engine;

import lombok.Builder;
import lombok.Value;
import org.springframework.lang.Nullable;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;
import ru.javaboys.huntysourcing.engine.score.KeywordMatch;
import ru.javaboys.huntysourcing.engine.verify.CompanyEvidence;

import java.util.List;

@Value
@Builder
public class CandidateDiagnostics {
    int fitScore;
    List<String> reasons;
    SeniorityLevel level;
    String query;

    // matcher diagnostics
    CompanyEvidence companyEvidence;
    boolean explicitAt;
    List<String> verifierReasons;
    KeywordMatch keywordMatch;
    @Nullable
    String domain;
}
