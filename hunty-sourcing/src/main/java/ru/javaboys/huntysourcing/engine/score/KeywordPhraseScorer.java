package ru.javaboys.huntysourcing.engine.score;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.PrecisionMode;
import ru.javaboys.huntysourcing.engine.keyword.KeywordExpander;
import ru.javaboys.huntysourcing.engine.keyword.KeywordVariant;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how well a keyword phrase is covered by a piece of title text.
 * Exact phrase containment scores 100, token overlap 50 + min(35, 15 * overlap), nothing 0.
 */
@RequiredArgsConstructor
public class KeywordPhraseScorer {

    static final int EXACT_SCORE = 100;
    static final int SINGLE_TOKEN_SCORE = 65;

    private final KeywordExpander keywordExpander;

    public KeywordMatch score(String keyword, String text) {
        Set<String> keywordTokens = significantTokens(keyword);
        if (TextNormalizer.normalize(keyword).isEmpty()) return KeywordMatch.NONE;

        if (TextNormalizer.containsPhrase(text, keyword)) {
            return new KeywordMatch(keyword, keyword, EXACT_SCORE, Math.max(1, keywordTokens.size()), true);
        }
        Set<String> overlap = new HashSet<>(keywordTokens);
        overlap.retainAll(new HashSet<>(TextNormalizer.tokens(text)));
        if (overlap.isEmpty()) return new KeywordMatch(keyword, keyword, 0, 0, false);
        int score = 50 + Math.min(35, overlap.size() * 15);
        return new KeywordMatch(keyword, keyword, score, overlap.size(), false);
    }

    /**
     * Best match over every keyword and the variants the precision mode allows.
     * Higher score wins, then larger overlap, then the earlier keyword.
     */
    public KeywordMatch bestMatch(List<String> keywords, String text, PrecisionMode mode) {
        KeywordMatch best = KeywordMatch.NONE;
        if (keywords == null || StringUtils.isBlank(text)) return best;

        for (String keyword : keywords) {
            for (KeywordVariant variant : keywordExpander.variantsFor(keyword, mode)) {
                KeywordMatch m = score(variant.getText(), text);
                if (m.getScore() == 0) continue;
                boolean phraseLevel = variant.getKind().isPhraseLevel();
                int score = phraseLevel ? m.getScore() : Math.min(m.getScore(), SINGLE_TOKEN_SCORE);
                KeywordMatch candidate = new KeywordMatch(keyword, variant.getText(), score, m.getOverlap(),
                        phraseLevel && score >= EXACT_SCORE);
                if (candidate.getScore() > best.getScore()
                        || (candidate.getScore() == best.getScore() && candidate.getOverlap() > best.getOverlap())) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    private Set<String> significantTokens(String phrase) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : TextNormalizer.tokens(phrase)) {
            if (keywordExpander.isSignificantToken(t)) out.add(t);
        }
        return out;
    }
}
