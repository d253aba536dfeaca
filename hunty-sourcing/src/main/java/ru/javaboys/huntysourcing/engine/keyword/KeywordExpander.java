package ru.javaboys.huntysourcing.engine.keyword;

import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.PrecisionMode;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a keyword phrase into matchable variants and builds the keyword set of a request.
 */
public class KeywordExpander {

    public static final Set<String> DESK_ACRONYMS = Set.of(
            "fx", "fig", "tmt", "ecm", "dcm", "abs", "mbs", "clo", "hy", "ig", "pe", "vc", "ib", "mna",
            "lbo", "ipo", "esg", "hr", "pb");

    static final Set<String> SENIORITY_WORDS = Set.of(
            "analyst", "associate", "vice", "president", "vp", "svp", "avp", "director", "managing",
            "executive", "md", "ed", "senior", "junior", "sr", "jr", "principal");

    private static final Set<String> STOPWORDS = Set.of(
            "and", "the", "for", "with", "from", "our", "team", "desk");

    private static final Pattern COMMA_SPLIT = Pattern.compile("[,;]");
    private static final Pattern SLASH_SPLIT = Pattern.compile("/");
    private static final String EDGE_PUNCT = "\"'`.,;:-()[]{} ";

    public List<String> expand(String phrase) {
        return expandVariants(phrase).stream().map(KeywordVariant::getText).collect(Collectors.toList());
    }

    public List<KeywordVariant> expandVariants(String phrase) {
        String canonical = canonicalize(phrase);
        List<KeywordVariant> out = new ArrayList<>();
        if (canonical.isEmpty()) return out;
        Set<String> keys = new HashSet<>();

        add(out, keys, canonical, KeywordVariant.Kind.PHRASE);

        List<String> commaParts = split(canonical, COMMA_SPLIT);
        if (commaParts.size() > 1) {
            commaParts.forEach(p -> add(out, keys, p, KeywordVariant.Kind.SPLIT));
        }
        for (String part : commaParts.isEmpty() ? List.of(canonical) : commaParts) {
            List<String> slashParts = split(part, SLASH_SPLIT);
            if (slashParts.size() > 1) {
                slashParts.forEach(p -> add(out, keys, p, KeywordVariant.Kind.SPLIT));
            }
        }

        String stripped = stripSeniority(canonical);
        if (!stripped.isEmpty() && !stripped.equalsIgnoreCase(canonical)) {
            add(out, keys, stripped, KeywordVariant.Kind.STRIPPED);
        }

        List<String> tokens = TextNormalizer.tokens(canonical);
        for (String token : tokens) {
            if (isSignificantToken(token)) add(out, keys, token, KeywordVariant.Kind.FRAGMENT);
        }
        for (String token : tokens) {
            if (DESK_ACRONYMS.contains(token)) {
                add(out, keys, token.toUpperCase(Locale.ROOT), KeywordVariant.Kind.ACRONYM);
            }
        }
        return out;
    }

    public List<KeywordVariant> variantsFor(String phrase, PrecisionMode mode) {
        List<KeywordVariant> all = expandVariants(phrase);
        if (mode == PrecisionMode.SEARCH) return all;
        return all.stream()
                .filter(v -> mode == PrecisionMode.STRICT
                        ? v.getKind() == KeywordVariant.Kind.PHRASE
                        : v.getKind().isPhraseLevel())
                .collect(Collectors.toList());
    }

    /**
     * Ordered union of the prioritized keyword lists (earlier lists win). When that is empty the
     * fallback tiers are tried in order until one yields something. Result is sorted most specific
     * phrase first and truncated to {@code max}.
     */
    public List<String> keywordSet(List<? extends Collection<String>> prioritized,
                                   List<? extends Collection<String>> fallbackTiers,
                                   int max) {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (Collection<String> list : prioritized) {
            if (list == null) continue;
            for (String kw : list) putCanonical(ordered, kw);
        }
        if (fallbackTiers != null) {
            for (Collection<String> tier : fallbackTiers) {
                if (!ordered.isEmpty()) break;
                if (tier == null) continue;
                for (String kw : tier) putCanonical(ordered, kw);
            }
        }
        return ordered.values().stream()
                .sorted(Comparator.comparingInt((String k) -> TextNormalizer.tokens(k).size()).reversed()
                        .thenComparing(Comparator.comparingInt(String::length).reversed()))
                .limit(Math.max(0, max))
                .collect(Collectors.toList());
    }

    public boolean isSignificantToken(String token) {
        if (DESK_ACRONYMS.contains(token)) return true;
        return token.length() >= 3 && !STOPWORDS.contains(token) && !SENIORITY_WORDS.contains(token);
    }

    public boolean isSeniorityOnly(String phrase) {
        List<String> tokens = TextNormalizer.tokens(phrase);
        return !tokens.isEmpty() && SENIORITY_WORDS.containsAll(tokens);
    }

    public static String canonicalize(String phrase) {
        return StringUtils.strip(TextNormalizer.collapseWhitespace(phrase), EDGE_PUNCT);
    }

    private String stripSeniority(String phrase) {
        String kept = Arrays.stream(phrase.split(" "))
                .filter(w -> {
                    String n = TextNormalizer.normalize(w);
                    return !n.isEmpty() && !SENIORITY_WORDS.contains(n);
                })
                .collect(Collectors.joining(" "));
        return canonicalize(kept);
    }

    private void add(List<KeywordVariant> out, Set<String> keys, String text, KeywordVariant.Kind kind) {
        String value = canonicalize(text);
        String key = TextNormalizer.normalize(value);
        if (key.isEmpty() || isSeniorityOnly(value)) return;
        if (keys.add(key)) out.add(new KeywordVariant(value, kind));
    }

    private static void putCanonical(Map<String, String> ordered, String keyword) {
        String canonical = canonicalize(keyword);
        String key = TextNormalizer.normalize(canonical);
        if (!key.isEmpty()) ordered.putIfAbsent(key, canonical);
    }

    private static List<String> split(String text, Pattern separator) {
        return Arrays.stream(separator.split(text))
                .map(KeywordExpander::canonicalize)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
