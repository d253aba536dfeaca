package ru.javaboys.huntysourcing.engine.text;

import org.apache.commons.lang3.StringUtils;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of free text shared by every matcher: lower case, no diacritics,
 * finance synonyms folded, punctuation replaced by spaces, single spaces.
 * Total function: {@code null} and blank input give an empty string.
 */
public final class TextNormalizer {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    // порядок важен: ibd раскрывается раньше, чем investment banking получает аббревиатуру
    private static final List<Synonym> SYNONYMS = List.of(
            new Synonym("\\bfixing income\\b", "fixed income"),
            new Synonym("\\bmergers\\s*(?:&|and)\\s*acquisitions\\b", "mna"),
            new Synonym("\\bm\\s*&\\s*a\\b", "mna"),
            new Synonym("\\bm\\s+and\\s+a\\b", "mna"),
            new Synonym("\\bsales\\s*(?:&|and)\\s*trading\\b", "sales trading"),
            new Synonym("\\bs\\s*&\\s*t\\b", "sales trading"),
            new Synonym("\\bibd\\b", "investment banking ib"),
            new Synonym("\\binvestment banking\\b(?!\\s+ib\\b)", "investment banking ib"),
            new Synonym("\\bforeign exchange\\b", "fx")
    );

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (StringUtils.isBlank(text)) return "";
        String s = foldDiacritics(text).toLowerCase(Locale.ROOT);
        for (Synonym synonym : SYNONYMS) {
            s = synonym.pattern.matcher(s).replaceAll(synonym.replacement);
        }
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        return SPACES.matcher(s).replaceAll(" ").trim();
    }

    public static String foldDiacritics(String text) {
        if (text == null) return "";
        return MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
    }

    public static List<String> tokens(String text) {
        String n = normalize(text);
        if (n.isEmpty()) return List.of();
        return new ArrayList<>(Arrays.asList(n.split(" ")));
    }

    /**
     * Whole-word phrase containment on normalized forms.
     */
    public static boolean containsPhrase(String haystack, String needle) {
        String n = normalize(needle);
        if (n.isEmpty()) return false;
        String h = normalize(haystack);
        return (" " + h + " ").contains(" " + n + " ");
    }

    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return SPACES.matcher(text).replaceAll(" ").trim();
    }

    private static final class Synonym {
        private final Pattern pattern;
        private final String replacement;

        private Synonym(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }
    }
}
