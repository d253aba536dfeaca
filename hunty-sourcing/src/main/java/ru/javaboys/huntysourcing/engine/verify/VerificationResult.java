package ru.javaboys.huntysourcing.engine.verify;

import lombok.Value;
import org.springframework.lang.Nullable;

import java.util.List;

@Value
public class VerificationResult {
    boolean accepted;
    @Nullable
    String company;
    List<String> reasons;
    CompanyEvidence evidence;
    boolean explicitAt;

    public VerificationResult(boolean accepted, @Nullable String company, List<String> reasons,
                              CompanyEvidence evidence, boolean explicitAt) {
        this.accepted = accepted;
        this.company = company;
        this.reasons = List.copyOf(reasons);
        this.evidence = evidence;
        this.explicitAt = explicitAt;
    }

    static VerificationResult rejected(String reason, boolean explicitAt) {
        return new VerificationResult(false, null, List.of(reason), CompanyEvidence.NONE, explicitAt);
    }
}
