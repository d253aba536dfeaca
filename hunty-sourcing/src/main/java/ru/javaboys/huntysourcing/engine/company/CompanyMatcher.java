package ru.javaboys.huntysourcing.engine.company;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fuzzy company-name comparison and email-domain lookup.
 */
public class CompanyMatcher {

    public static final int DOMAIN_ACCEPT_SCORE = 60;

    private static final Pattern DROPPED_CHARS = Pattern.compile("[.'’]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    @Getter
    private final CompanyNameRules rules;
    private final CompanyDirectory directory;

    public CompanyMatcher(CompanyNameRules rules, CompanyDirectory directory) {
        this.rules = rules;
        this.directory = directory;
    }

    /**
     * Canonical company name with trailing division / legal suffixes removed.
     */
    public String normalizeCompany(String name) {
        String s = basic(name);
        if (s.isEmpty() || rules.getNoTruncate().contains(s)) return s;

        boolean stripped = true;
        while (stripped && !rules.getNoTruncate().contains(s)) {
            stripped = false;
            for (String suffix : rules.getSuffixes()) {
                if (s.endsWith(" " + suffix)) {
                    s = s.substring(0, s.length() - suffix.length() - 1).trim();
                    stripped = true;
                    break;
                }
            }
        }
        return s;
    }

    public List<String> tokens(String name) {
        String n = normalizeCompany(name);
        if (n.isEmpty()) return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (String t : n.split(" ")) {
            if (t.length() >= 2 && !rules.isGeneric(t)) out.add(t);
        }
        return new ArrayList<>(out);
    }

    public String acronym(String name) {
        List<String> tokens = tokens(name);
        if (tokens.isEmpty()) return "";
        if (tokens.size() == 1) {
            String only = tokens.get(0);
            return only.length() <= 4 ? only : "";
        }
        StringBuilder sb = new StringBuilder();
        for (String t : tokens) sb.append(t.charAt(0));
        return sb.toString();
    }

    public boolean companiesMatch(String a, String b) {
        String na = normalizeCompany(a);
        String nb = normalizeCompany(b);
        if (na.isEmpty() || nb.isEmpty()) return false;
        if (na.equals(nb) || na.replace(" ", "").equals(nb.replace(" ", ""))) return true;

        String acrA = acronym(a);
        if (!acrA.isEmpty() && acrA.equals(acronym(b))) return true;

        Set<String> ta = new LinkedHashSet<>(tokens(a));
        Set<String> tb = new LinkedHashSet<>(tokens(b));
        Set<String> overlap = new HashSet<>(ta);
        overlap.retainAll(tb);
        if (overlap.isEmpty()) return false;

        // "Man Group" не должен совпадать с "Man Numeric"
        if (isShortSingleToken(ta) || isShortSingleToken(tb)) {
            Set<String> extra = new HashSet<>(ta);
            extra.addAll(tb);
            extra.removeAll(overlap);
            if (!extra.isEmpty()) return false;
        }
        return ta.containsAll(tb) || tb.containsAll(ta) || overlap.size() >= Math.min(ta.size(), tb.size());
    }

    /**
     * Tries each candidate name in order: exact directory key, then substring containment,
     * then token overlap. First hit at or above {@link #DOMAIN_ACCEPT_SCORE} wins.
     */
    public Optional<DomainMatch> resolveDomain(String... candidates) {
        Set<String> seen = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (StringUtils.isBlank(candidate)) continue;
            if (!seen.add(candidate.trim().toLowerCase(Locale.ROOT))) continue;

            Optional<DomainMatch> hit = exact(candidate)
                    .or(() -> bestContainment(candidate))
                    .or(() -> bestTokenOverlap(candidate));
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    private Optional<DomainMatch> exact(String candidate) {
        String raw = candidate.trim().toLowerCase(Locale.ROOT);
        String domain = directory.get(raw);
        if (domain != null) return Optional.of(new DomainMatch(domain, raw, 100));

        String norm = normalizeCompany(candidate);
        for (Map.Entry<String, String> e : directory.entries().entrySet()) {
            if (e.getKey().equals(norm) || normalizeCompany(e.getKey()).equals(norm)) {
                return Optional.of(new DomainMatch(e.getValue(), e.getKey(), 100));
            }
        }
        return Optional.empty();
    }

    private Optional<DomainMatch> bestContainment(String candidate) {
        String norm = normalizeCompany(candidate);
        if (norm.length() < 3) return Optional.empty();
        DomainMatch best = null;
        for (Map.Entry<String, String> e : directory.entries().entrySet()) {
            String key = normalizeCompany(e.getKey());
            if (key.length() < 3) continue;
            if (!norm.contains(key) && !key.contains(norm)) continue;
            int score = Math.round(100f * Math.min(norm.length(), key.length()) / Math.max(norm.length(), key.length()));
            if (best == null || score > best.getScore()) {
                best = new DomainMatch(e.getValue(), e.getKey(), score);
            }
        }
        return accept(best);
    }

    private Optional<DomainMatch> bestTokenOverlap(String candidate) {
        List<String> ct = tokens(candidate);
        if (ct.isEmpty()) return Optional.empty();
        DomainMatch best = null;
        for (Map.Entry<String, String> e : directory.entries().entrySet()) {
            List<String> kt = tokens(e.getKey());
            if (kt.isEmpty()) continue;
            Set<String> overlap = new HashSet<>(ct);
            overlap.retainAll(kt);
            if (overlap.isEmpty()) continue;
            int score = Math.round(100f * overlap.size() / Math.max(ct.size(), kt.size()));
            if (best == null || score > best.getScore()) {
                best = new DomainMatch(e.getValue(), e.getKey(), score);
            }
        }
        return accept(best);
    }

    private static Optional<DomainMatch> accept(DomainMatch best) {
        return best != null && best.getScore() >= DOMAIN_ACCEPT_SCORE ? Optional.of(best) : Optional.empty();
    }

    private static boolean isShortSingleToken(Set<String> tokens) {
        return tokens.size() == 1 && tokens.iterator().next().length() <= 4;
    }

    private static String basic(String name) {
        if (StringUtils.isBlank(name)) return "";
        String s = TextNormalizer.foldDiacritics(name).toLowerCase(Locale.ROOT).replace("&", " and ");
        s = DROPPED_CHARS.matcher(s).replaceAll("");
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        s = TextNormalizer.collapseWhitespace(s);
        if (s.startsWith("the ")) s = s.substring(4);
        return s;
    }
}
