package ru.javaboys.huntysourcing.engine.verify;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.PrecisionMode;
import ru.javaboys.huntysourcing.engine.company.CompanyMatcher;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a parsed result is a current, full-time role at the target company.
 */
@RequiredArgsConstructor
public class CurrentRoleVerifier {

    public static final Pattern PRIOR_ROLE = Pattern.compile("\\b(former|formerly|previously|past)\\b|\\bex-");
    public static final Pattern NON_FULL_TIME = Pattern.compile(
            "\\b(intern|interns|internship|summer analyst|summer associate|off-cycle|off cycle|part-time|part time"
                    + "|incoming|seasonal|contractor)\\b");

    private static final Pattern AT_CLAUSE = Pattern.compile("(?i)(?:^|\\s)(?:at\\s+|@\\s*)(.+)$");
    private static final Pattern FRAGMENT_END = Pattern.compile("[|(,;/]");
    private static final String SEGMENT_SEPARATOR = " - ";

    private final CompanyMatcher companyMatcher;

    public VerificationResult verify(String roleText, String targetCompany, String snippet, PrecisionMode mode) {
        String role = roleText == null ? "" : roleText.trim();
        String primary = role.split("\\|", 2)[0].trim();
        String lowerPrimary = primary.toLowerCase(Locale.ROOT);

        Matcher at = AT_CLAUSE.matcher(primary);
        boolean hasAt = at.find();

        if (PRIOR_ROLE.matcher(lowerPrimary).find()) {
            return VerificationResult.rejected("Title marks a former role", hasAt);
        }
        if (NON_FULL_TIME.matcher(lowerPrimary).find()) {
            return VerificationResult.rejected("Internship or non-full-time role", hasAt);
        }
        if (mode == PrecisionMode.STRICT && !hasAt) {
            return VerificationResult.rejected("No explicit 'at <company>' clause", false);
        }
        if (role.isEmpty()) {
            return VerificationResult.rejected("No role text", false);
        }

        String fragment = trimFragment(hasAt ? at.group(1) : lastSegment(primary));
        String target = targetCompany == null ? "" : targetCompany.trim();
        String targetNorm = companyMatcher.normalizeCompany(target);

        boolean exact = !fragment.isEmpty() && !targetNorm.isEmpty()
                && companyMatcher.normalizeCompany(fragment).equals(targetNorm);
        boolean loose = !exact && !fragment.isEmpty() && companyMatcher.companiesMatch(fragment, target);
        boolean mention = mentions(role, target, targetNorm);
        boolean inSnippet = mentions(snippet, target, targetNorm);

        CompanyEvidence evidence;
        if (exact) {
            evidence = CompanyEvidence.EXACT;
        } else if (loose) {
            evidence = CompanyEvidence.LOOSE;
        } else if (mention && mode == PrecisionMode.SEARCH && !hasAt) {
            // явный "at" с другой компанией важнее упоминания
            evidence = CompanyEvidence.MENTION;
        } else if (inSnippet && mode == PrecisionMode.SEARCH) {
            evidence = CompanyEvidence.SNIPPET;
        } else {
            String why = fragment.isEmpty()
                    ? "No company found in title"
                    : "Company '" + fragment + "' does not match " + target;
            return VerificationResult.rejected(why, hasAt);
        }

        List<String> reasons = new ArrayList<>();
        String company = target;
        switch (evidence) {
            case EXACT:
                company = fragment;
                reasons.add("Current role at " + fragment);
                break;
            case LOOSE:
                company = fragment;
                reasons.add("Company '" + fragment + "' matches " + target);
                break;
            case MENTION:
                reasons.add("Title mentions " + target);
                break;
            default:
                reasons.add("Snippet mentions " + target);
        }
        // не блокирует, только предупреждение
        int bar = role.indexOf('|');
        String tail = bar >= 0 ? role.substring(bar + 1) : "";
        if (PRIOR_ROLE.matcher(tail.toLowerCase(Locale.ROOT)).find()) {
            reasons.add("Title mentions a prior role");
        }
        if (snippet != null && PRIOR_ROLE.matcher(snippet.toLowerCase(Locale.ROOT)).find()) {
            reasons.add("Snippet mentions a prior role");
        }
        return new VerificationResult(true, company, reasons, evidence, hasAt);
    }

    /**
     * Job title part of the role text: before the "at" clause, else the first hyphen segment.
     */
    public String titlePart(String roleText) {
        if (roleText == null) return "";
        String primary = roleText.split("\\|", 2)[0].trim();
        Matcher at = AT_CLAUSE.matcher(primary);
        if (at.find()) return primary.substring(0, at.start()).trim();
        int sep = primary.indexOf(SEGMENT_SEPARATOR);
        return sep >= 0 ? primary.substring(0, sep).trim() : primary;
    }

    public boolean hasNonFullTimeMarker(String text) {
        return text != null && NON_FULL_TIME.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    private boolean mentions(String text, String target, String targetNorm) {
        if (StringUtils.isBlank(text) || target.isEmpty()) return false;
        return TextNormalizer.containsPhrase(text, target)
                || (!targetNorm.isEmpty() && TextNormalizer.containsPhrase(text, targetNorm));
    }

    private static String lastSegment(String primary) {
        String[] parts = primary.split(Pattern.quote(SEGMENT_SEPARATOR));
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isBlank()) return parts[i].trim();
        }
        return "";
    }

    private static String trimFragment(String fragment) {
        if (fragment == null) return "";
        Matcher m = FRAGMENT_END.matcher(fragment);
        String s = m.find() ? fragment.substring(0, m.start()) : fragment;
        int sep = s.indexOf(SEGMENT_SEPARATOR);
        if (sep >= 0) s = s.substring(0, sep);
        s = s.trim();
        while (s.endsWith(".")) s = s.substring(0, s.length() - 1).trim();
        return s;
    }
}
