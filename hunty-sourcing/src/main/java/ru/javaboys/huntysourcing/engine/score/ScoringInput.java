package ru.javaboys.huntysourcing.engine.score;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.lang.Nullable;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.List;

/**
 * Everything the fit scorer looks at for one candidate.
 */
@Value
@Builder
public class ScoringInput {
    String targetCompany;
    String company;
    boolean currentRole;
    String title;
    String roleText;
    String city;
    @Singular
    List<String> targetCities;
    SeniorityLevel level;
    @Singular
    List<SeniorityLevel> targetLevels;
    @Singular
    List<String> keywords;
    @Singular
    List<String> jobTerms;
    @Nullable
    String school;
    @Nullable
    String email;
}
