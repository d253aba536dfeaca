package ru.javaboys.huntysourcing.engine.score;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.javaboys.huntysourcing.engine.PrecisionMode;
import ru.javaboys.huntysourcing.engine.company.CompanyDirectory;
import ru.javaboys.huntysourcing.engine.company.CompanyMatcher;
import ru.javaboys.huntysourcing.engine.company.CompanyNameRules;
import ru.javaboys.huntysourcing.engine.keyword.KeywordExpander;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FitScorerTest {

    private final FitScorer scorer = new FitScorer(
            new CompanyMatcher(CompanyNameRules.defaults(), CompanyDirectory.empty()), new KeywordExpander());

    private ScoringInput.ScoringInputBuilder strongCandidate() {
        return ScoringInput.builder()
                .targetCompany("Goldman Sachs")
                .company("Goldman Sachs")
                .currentRole(true)
                .title("Leveraged Finance Associate")
                .roleText("Leveraged Finance Associate at Goldman Sachs")
                .city("New York")
                .targetCity("New York")
                .level(SeniorityLevel.ASSOCIATE)
                .targetLevel(SeniorityLevel.ANALYST)
                .targetLevel(SeniorityLevel.ASSOCIATE)
                .keyword("Leveraged Finance")
                .jobTerm("Leveraged Finance Associate")
                .email("jane.doe@gs.com");
    }

    @Nested
    @DisplayName("score")
    class Score {

        @Test
        void shouldClampAtHundredAndKeepFourStrongestReasons() {
            FitScore fit = scorer.score(strongCandidate().build(), PrecisionMode.SEARCH);

            assertThat(fit.getScore()).isEqualTo(100);
            assertThat(fit.getReasons()).containsExactly(
                    "Company matches Goldman Sachs",
                    "Current role confirmed",
                    "Located in New York",
                    "Keyword 'Leveraged Finance' in title");
            assertThat(fit.getKeywordMatch().isStrong()).isTrue();
            assertThat(fit.getKeywordMatch().isExactPhrase()).isTrue();
        }

        @Test
        void shouldClampAtZeroForInterns() {
            ScoringInput input = ScoringInput.builder()
                    .targetCompany("Goldman Sachs")
                    .company("Acme")
                    .title("Summer Intern")
                    .roleText("Summer Intern")
                    .city("")
                    .level(SeniorityLevel.UNKNOWN)
                    .targetLevel(SeniorityLevel.ANALYST)
                    .keyword("Leveraged Finance")
                    .build();

            FitScore fit = scorer.score(input, PrecisionMode.SEARCH);

            assertThat(fit.getScore()).isZero();
            assertThat(fit.getReasons()).containsExactly(
                    "Seniority not detected", "No keyword match", "Intern or non-full-time title");
        }

        @Test
        void shouldGivePartialCreditForTokenOverlap() {
            FitScore fit = scorer.score(strongCandidate()
                    .title("Finance Associate")
                    .roleText("Finance Associate at Goldman Sachs")
                    .build(), PrecisionMode.SEARCH);

            assertThat(fit.getKeywordMatch().isPartial()).isTrue();
            assertThat(fit.getKeywordMatch().getScore()).isEqualTo(65);
            assertThat(fit.getReasons()).doesNotContain("No keyword match");
        }

        @Test
        void shouldPenalizeLevelOutsideTarget() {
            FitScore inTarget = scorer.score(strongCandidate().build(), PrecisionMode.SEARCH);
            FitScore outside = scorer.score(strongCandidate()
                    .company("Acme")
                    .currentRole(false)
                    .level(SeniorityLevel.MANAGING_DIRECTOR)
                    .build(), PrecisionMode.SEARCH);

            assertThat(outside.getScore()).isLessThan(inTarget.getScore());
            assertThat(outside.getReasons()).contains("Seniority Managing Director outside target");
        }

        @Test
        void shouldSkipKeywordRulesWithoutKeywords() {
            ScoringInput input = ScoringInput.builder()
                    .targetCompany("Lazard")
                    .company("Lazard")
                    .title("Analyst")
                    .roleText("Analyst at Lazard")
                    .level(SeniorityLevel.ANALYST)
                    .build();

            FitScore fit = scorer.score(input, PrecisionMode.SEARCH);

            // 18 + 30 (company) + 5 (seniority, no targets)
            assertThat(fit.getScore()).isEqualTo(53);
            assertThat(fit.getReasons()).noneMatch(r -> r.contains("keyword"));
        }

        @Test
        void shouldRewardRecruitingRoles() {
            ScoringInput input = ScoringInput.builder()
                    .targetCompany("Lazard")
                    .company("Lazard")
                    .title("Campus Recruiter")
                    .roleText("Campus Recruiter at Lazard")
                    .level(SeniorityLevel.UNKNOWN)
                    .build();

            // 18 + 30 - 10 + 5
            assertThat(scorer.score(input, PrecisionMode.SEARCH).getScore()).isEqualTo(43);
        }
    }

    @Test
    void mostInformative_shouldDedupAndKeepEvaluationOrder() {
        List<String> reasons = FitScorer.mostInformative(List.of(
                new Adjustment(4, "a"),
                new Adjustment(30, "b"),
                new Adjustment(-35, "c"),
                new Adjustment(30, "b"),
                new Adjustment(5, "d"),
                new Adjustment(-24, "e")));

        assertThat(reasons).containsExactly("b", "c", "d", "e");
    }

    @Test
    void mostInformative_shouldReturnUnmodifiableList() {
        List<String> reasons = FitScorer.mostInformative(List.of(new Adjustment(30, "b")));

        assertThatThrownBy(() -> reasons.add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void clamp_shouldBoundScore() {
        assertThat(FitScorer.clamp(-7)).isZero();
        assertThat(FitScorer.clamp(130)).isEqualTo(100);
        assertThat(FitScorer.clamp(42)).isEqualTo(42);
    }
}
