package ru.javaboys.huntysourcing.engine.role;

import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps title text to a seniority level. Rules are tried top to bottom and the first hit wins,
 * so the most senior labels come first ("Managing Director" also contains "director").
 */
public class RoleClassifier {

    private static final Map<Pattern, SeniorityLevel> RULES = new LinkedHashMap<>();

    static {
        RULES.put(Pattern.compile("\\bmanaging director\\b|\\bmd\\b"), SeniorityLevel.MANAGING_DIRECTOR);
        RULES.put(Pattern.compile("\\bexecutive director\\b"), SeniorityLevel.EXECUTIVE_DIRECTOR);
        RULES.put(Pattern.compile("\\bvice president\\b|\\b[sa]?vp\\b"), SeniorityLevel.VP);
        RULES.put(Pattern.compile("\\bprincipal\\b"), SeniorityLevel.DIRECTOR);
        RULES.put(Pattern.compile("\\bdirector\\b"), SeniorityLevel.DIRECTOR);
        RULES.put(Pattern.compile("\\bassociate\\b"), SeniorityLevel.ASSOCIATE);
        RULES.put(Pattern.compile("\\banalyst\\b"), SeniorityLevel.ANALYST);
    }

    public SeniorityLevel detectLevel(String titleText) {
        if (StringUtils.isBlank(titleText)) return SeniorityLevel.UNKNOWN;
        String t = titleText.toLowerCase(Locale.ROOT).replace('-', ' ');
        for (Map.Entry<Pattern, SeniorityLevel> rule : RULES.entrySet()) {
            if (rule.getKey().matcher(t).find()) return rule.getValue();
        }
        return SeniorityLevel.UNKNOWN;
    }
}
