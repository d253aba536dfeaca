package ru.javaboys.huntysourcing.engine.query;

import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;
import ru.javaboys.huntysourcing.engine.role.SeniorityLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds profile-search query strings for every (city, keyword, level) combination of a company.
 */
public class QuerySynthesizer {

    public static final String SITE_CLAUSE = "site:linkedin.com/in";

    private static final Map<SeniorityLevel, List<String>> LEVEL_TERMS = new EnumMap<>(SeniorityLevel.class);

    static {
        LEVEL_TERMS.put(SeniorityLevel.ANALYST, List.of("Analyst"));
        LEVEL_TERMS.put(SeniorityLevel.ASSOCIATE, List.of("Associate"));
        LEVEL_TERMS.put(SeniorityLevel.VP, List.of("\"Vice President\"", "VP"));
        LEVEL_TERMS.put(SeniorityLevel.DIRECTOR, List.of("Director"));
        LEVEL_TERMS.put(SeniorityLevel.EXECUTIVE_DIRECTOR, List.of("\"Executive Director\""));
        LEVEL_TERMS.put(SeniorityLevel.MANAGING_DIRECTOR, List.of("\"Managing Director\"", "MD"));
    }

    private final boolean excludeSeniorLevels;

    public QuerySynthesizer(boolean excludeSeniorLevels) {
        this.excludeSeniorLevels = excludeSeniorLevels;
    }

    /**
     * Queries in city → keyword → level order. Without selected levels a single query per
     * (city, keyword) is produced, without a level clause.
     */
    public List<SearchQuery> plan(String company, List<String> cities, List<String> keywords, List<SeniorityLevel> levels) {
        List<String> cityList = cities == null || cities.isEmpty() ? List.of("") : cities;
        List<SeniorityLevel> levelList = levels == null || levels.isEmpty()
                ? Collections.singletonList(null)
                : levels;

        List<SearchQuery> out = new ArrayList<>();
        for (String city : cityList) {
            for (String keyword : keywords) {
                for (SeniorityLevel level : levelList) {
                    String text = buildQuery(company, city, keyword, level, levels);
                    out.add(new SearchQuery(company, city == null ? "" : city, keyword, level, text));
                }
            }
        }
        return out;
    }

    public String buildQuery(String company, String city, String keyword,
                             @Nullable SeniorityLevel level, List<SeniorityLevel> selected) {
        List<String> parts = new ArrayList<>();
        parts.add(SITE_CLAUSE);
        if (StringUtils.isNotBlank(keyword)) parts.add(quote(keyword));
        if (level != null && level.isKnown()) parts.add(levelClause(level));
        if (StringUtils.isNotBlank(company)) parts.add(quote(company));
        if (StringUtils.isNotBlank(city)) parts.add(quote(city));
        if (excludeSeniorLevels) {
            String suffix = exclusionSuffix(selected);
            if (!suffix.isEmpty()) parts.add(suffix);
        }
        return String.join(" ", parts);
    }

    /**
     * Negative terms for every level strictly above the most senior selected one.
     */
    public String exclusionSuffix(List<SeniorityLevel> selected) {
        if (selected == null || selected.isEmpty()) return "";
        SeniorityLevel highest = null;
        for (SeniorityLevel l : selected) {
            if (l != null && l.isKnown() && (highest == null || l.isSeniorTo(highest))) highest = l;
        }
        if (highest == null) return "";

        List<String> terms = new ArrayList<>();
        for (SeniorityLevel l : SeniorityLevel.values()) {
            if (l.isSeniorTo(highest)) {
                LEVEL_TERMS.get(l).forEach(t -> terms.add("-" + t));
            }
        }
        return String.join(" ", terms);
    }

    public static String levelClause(SeniorityLevel level) {
        List<String> terms = LEVEL_TERMS.getOrDefault(level, List.of());
        if (terms.size() == 1) return terms.get(0);
        return terms.stream().collect(Collectors.joining(" OR ", "(", ")"));
    }

    private static String quote(String s) {
        return "\"" + s.replace("\"", "").trim() + "\"";
    }
}
