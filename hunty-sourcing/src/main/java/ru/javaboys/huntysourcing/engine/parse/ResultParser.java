package ru.javaboys.huntysourcing.engine.parse;

import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a person and a role fragment out of a search-result title, and a city out of a snippet.
 * Typical title: "Jane Doe - Campus Recruiter - Goldman Sachs | LinkedIn".
 */
public class ResultParser {

    private static final String SEPARATOR = " - ";
    private static final Pattern BRAND_SUFFIX = Pattern.compile("\\s*[|·\\-–—]\\s*LinkedIn\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ELLIPSIS = Pattern.compile("\\s*(\\.\\.\\.|…)\\s*$");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");

    // первый сработавший шаблон побеждает
    private static final List<Pattern> CITY_PATTERNS = List.of(
            Pattern.compile("([A-Z][a-zA-Z ]+), United States"),
            Pattern.compile("Greater ([A-Z][a-zA-Z ]+) Area"),
            Pattern.compile("([A-Z][a-zA-Z ]+) Area"),
            Pattern.compile("([A-Z][a-zA-Z ]+), [A-Z]{2}\\b")
    );

    public ParsedTitle parseTitle(String rawTitle) {
        if (StringUtils.isBlank(rawTitle)) return new ParsedTitle("", "");
        String text = TRAILING_ELLIPSIS.matcher(rawTitle.trim()).replaceAll("");
        text = BRAND_SUFFIX.matcher(text).replaceAll("").trim();

        if (!text.contains(SEPARATOR)) {
            String name = text.split("\\|", 2)[0].trim();
            return new ParsedTitle(name, "");
        }

        List<String> parts = new ArrayList<>();
        for (String p : text.split(Pattern.quote(SEPARATOR))) {
            if (!p.isBlank()) parts.add(p.trim());
        }
        if (parts.isEmpty()) return new ParsedTitle("", "");
        String name = parts.get(0);
        String roleCompany = String.join(SEPARATOR, parts.subList(1, parts.size()));
        return new ParsedTitle(name, roleCompany);
    }

    public PersonName cleanFullName(String rawName) {
        if (rawName == null) return new PersonName("", "", "");
        String s = PARENTHETICAL.matcher(rawName).replaceAll(" ");
        int comma = s.indexOf(',');
        if (comma >= 0) s = s.substring(0, comma);
        s = s.replace(".", "");
        s = TextNormalizer.collapseWhitespace(s);
        if (s.isEmpty()) return new PersonName("", "", "");

        String[] tokens = s.split(" ");
        String first = tokens[0];
        String last = tokens.length >= 2 ? tokens[tokens.length - 1] : "";
        return new PersonName(s, first, last);
    }

    public String extractCity(String snippet) {
        if (StringUtils.isBlank(snippet)) return "";
        for (Pattern p : CITY_PATTERNS) {
            Matcher m = p.matcher(snippet);
            if (m.find()) return m.group(1).trim();
        }
        return "";
    }
}
