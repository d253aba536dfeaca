package ru.javaboys.huntysourcing.engine;

import lombok.Builder;
import lombok.Value;
import org.springframework.lang.Nullable;

/**
 * A ranked contact row. Created once per run and never changed afterwards.
 */
@Value
@Builder
public class Candidate {
    String fullName;
    String firstName;
    String lastName;
    String title;
    String company;
    String city;
    @Nullable
    String school;
    String url;
    String email; // "N/A" если не нашли
    CandidateDiagnostics diagnostics;

    public int getFitScore() {
        return diagnostics.getFitScore();
    }

    public String identityKey() {
        return IdentityKeys.of(this);
    }
}
