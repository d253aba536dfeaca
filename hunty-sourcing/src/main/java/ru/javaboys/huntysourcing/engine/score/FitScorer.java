package ru.javaboys.huntysourcing.engine.score;

import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.PrecisionMode;
import ru.javaboys.huntysourcing.engine.company.CompanyMatcher;
import ru.javaboys.huntysourcing.engine.keyword.KeywordExpander;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;
import ru.javaboys.huntysourcing.engine.verify.CurrentRoleVerifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Folds an ordered list of weighted rules over a base score, then clamps to 0..100.
 */
public class FitScorer {

    public static final int BASE_SCORE = 18;
    public static final int MAX_REASONS = 4;
    public static final String NO_EMAIL = "N/A";

    private static final Pattern RECRUITING = Pattern.compile(
            "\\b(recruit\\w*|talent acquisition|campus|human resources|hr|people partner)\\b");

    private final CompanyMatcher companyMatcher;
    private final KeywordExpander keywordExpander;
    private final KeywordPhraseScorer keywordScorer;
    private final List<ScoringRule> rules;

    public FitScorer(CompanyMatcher companyMatcher, KeywordExpander keywordExpander) {
        this.companyMatcher = companyMatcher;
        this.keywordExpander = keywordExpander;
        this.keywordScorer = new KeywordPhraseScorer(keywordExpander);
        this.rules = List.of(
                this::companyRule,
                this::currentRoleRule,
                this::cityRule,
                this::seniorityRule,
                this::keywordRule,
                this::exactKeywordRule,
                this::jobTitleRule,
                this::schoolRule,
                this::emailRule,
                this::internRule,
                this::recruitingRule
        );
    }

    public FitScore score(ScoringInput input, PrecisionMode mode) {
        String text = StringUtils.isBlank(input.getTitle()) ? input.getRoleText() : input.getTitle();
        KeywordMatch keywordMatch = keywordScorer.bestMatch(input.getKeywords(), text, mode);
        ScoringContext ctx = new ScoringContext(input, keywordMatch);

        List<Adjustment> applied = new ArrayList<>();
        int total = BASE_SCORE;
        for (ScoringRule rule : rules) {
            Optional<Adjustment> adj = rule.apply(ctx);
            if (adj.isPresent()) {
                applied.add(adj.get());
                total += adj.get().getDelta();
            }
        }
        return new FitScore(clamp(total), mostInformative(applied), keywordMatch);
    }

    public KeywordPhraseScorer getKeywordScorer() {
        return keywordScorer;
    }

    // -------- rules --------

    private Optional<Adjustment> companyRule(ScoringContext ctx) {
        ScoringInput in = ctx.getInput();
        if (companyMatcher.companiesMatch(in.getCompany(), in.getTargetCompany())) {
            return adjust(30, "Company matches " + in.getTargetCompany());
        }
        return Optional.empty();
    }

    private Optional<Adjustment> currentRoleRule(ScoringContext ctx) {
        return ctx.getInput().isCurrentRole() ? adjust(22, "Current role confirmed") : Optional.empty();
    }

    private Optional<Adjustment> cityRule(ScoringContext ctx) {
        ScoringInput in = ctx.getInput();
        String city = firstSegment(in.getCity());
        if (city.isEmpty()) return Optional.empty();
        for (String target : in.getTargetCities()) {
            String t = firstSegment(target);
            if (t.isEmpty()) continue;
            if (city.startsWith(t) || t.startsWith(city) || city.contains(t) || t.contains(city)) {
                return adjust(20, "Located in " + in.getCity());
            }
        }
        return Optional.empty();
    }

    private Optional<Adjustment> seniorityRule(ScoringContext ctx) {
        ScoringInput in = ctx.getInput();
        SeniorityLevel level = in.getLevel() == null ? SeniorityLevel.UNKNOWN : in.getLevel();
        if (!level.isKnown()) {
            return adjust(-10, "Seniority not detected");
        }
        if (in.getTargetLevels().isEmpty() || in.getTargetLevels().contains(level)) {
            return adjust(5, "Seniority " + level.getId() + " in target");
        }
        return adjust(-35, "Seniority " + level.getId() + " outside target");
    }

    private Optional<Adjustment> keywordRule(ScoringContext ctx) {
        if (ctx.getInput().getKeywords().isEmpty()) return Optional.empty();
        KeywordMatch m = ctx.getKeywordMatch();
        if (m.isStrong()) {
            return adjust(Math.min(52, 36 + 4 * m.getOverlap()), "Keyword '" + m.getKeyword() + "' in title");
        }
        if (m.isPartial()) {
            int bonus = Math.max(4, Math.min(16, (m.getScore() - 50) / 2));
            return adjust(bonus, "Partial keyword match '" + m.getVariant() + "'");
        }
        return adjust(-24, "No keyword match");
    }

    private Optional<Adjustment> exactKeywordRule(ScoringContext ctx) {
        KeywordMatch m = ctx.getKeywordMatch();
        if (!ctx.getInput().getKeywords().isEmpty() && m.isStrong() && m.isExactPhrase()) {
            return adjust(12, "Exact keyword phrase");
        }
        return Optional.empty();
    }

    private Optional<Adjustment> jobTitleRule(ScoringContext ctx) {
        ScoringInput in = ctx.getInput();
        Set<String> jobTokens = new LinkedHashSet<>();
        for (String term : in.getJobTerms()) {
            for (String t : TextNormalizer.tokens(term)) {
                if (t.length() >= 3 && keywordExpander.isSignificantToken(t)) jobTokens.add(t);
            }
        }
        if (jobTokens.isEmpty()) return Optional.empty();
        Set<String> titleTokens = new LinkedHashSet<>(TextNormalizer.tokens(in.getTitle()));
        List<String> overlap = jobTokens.stream().filter(titleTokens::contains).collect(Collectors.toList());
        if (overlap.isEmpty()) return Optional.empty();
        int bonus = overlap.size() >= 3 ? 18 : overlap.size() == 2 ? 10 : 4;
        return adjust(bonus, "Title overlaps job: " + String.join(", ", overlap));
    }

    private Optional<Adjustment> schoolRule(ScoringContext ctx) {
        String school = ctx.getInput().getSchool();
        return StringUtils.isBlank(school) ? Optional.empty() : adjust(7, "School: " + school);
    }

    private Optional<Adjustment> emailRule(ScoringContext ctx) {
        String email = ctx.getInput().getEmail();
        if (StringUtils.isBlank(email) || NO_EMAIL.equalsIgnoreCase(email.trim())) return Optional.empty();
        return adjust(4, "Email found");
    }

    private Optional<Adjustment> internRule(ScoringContext ctx) {
        String title = ctx.getInput().getTitle();
        if (title != null && CurrentRoleVerifier.NON_FULL_TIME.matcher(title.toLowerCase(Locale.ROOT)).find()) {
            return adjust(-35, "Intern or non-full-time title");
        }
        return Optional.empty();
    }

    private Optional<Adjustment> recruitingRule(ScoringContext ctx) {
        String title = TextNormalizer.normalize(ctx.getInput().getTitle());
        return RECRUITING.matcher(title).find() ? adjust(5, "Recruiting-facing role") : Optional.empty();
    }

    // -------- helpers --------

    /**
     * Dedups reasons, keeps the four with the largest absolute weight, reports them in evaluation order.
     */
    static List<String> mostInformative(List<Adjustment> applied) {
        Map<String, Integer> firstIndex = new LinkedHashMap<>();
        Map<String, Integer> weight = new LinkedHashMap<>();
        for (int i = 0; i < applied.size(); i++) {
            Adjustment a = applied.get(i);
            if (firstIndex.putIfAbsent(a.getReason(), i) == null) {
                weight.put(a.getReason(), Math.abs(a.getDelta()));
            }
        }
        return firstIndex.keySet().stream()
                .sorted(Comparator.comparingInt((String r) -> weight.get(r)).reversed()
                        .thenComparingInt(firstIndex::get))
                .limit(MAX_REASONS)
                .sorted(Comparator.comparingInt(firstIndex::get))
                .collect(Collectors.toUnmodifiableList());
    }

    static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }

    private static Optional<Adjustment> adjust(int delta, String reason) {
        return Optional.of(new Adjustment(delta, reason));
    }

    private static String firstSegment(String city) {
        if (city == null) return "";
        return TextNormalizer.normalize(city.split(",", 2)[0]);
    }
}
