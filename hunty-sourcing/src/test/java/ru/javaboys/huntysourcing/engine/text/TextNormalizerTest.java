package ru.javaboys.huntysourcing.engine.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void normalize_shouldFoldFinanceSynonyms() {
        assertThat(TextNormalizer.normalize("Mergers & Acquisitions")).isEqualTo("mna");
        assertThat(TextNormalizer.normalize("M&A Analyst")).isEqualTo("mna analyst");
        assertThat(TextNormalizer.normalize("Sales & Trading")).isEqualTo("sales trading");
        assertThat(TextNormalizer.normalize("Foreign Exchange Sales")).isEqualTo("fx sales");
        assertThat(TextNormalizer.normalize("Fixing Income")).isEqualTo("fixed income");
    }

    @Test
    void normalize_shouldExpandInvestmentBankingOnce() {
        assertThat(TextNormalizer.normalize("IBD")).isEqualTo("investment banking ib");
        assertThat(TextNormalizer.normalize("Investment Banking")).isEqualTo("investment banking ib");
        assertThat(TextNormalizer.normalize("Investment Banking IB")).isEqualTo("investment banking ib");
    }

    @Test
    void normalize_shouldStripDiacriticsAndPunctuation() {
        assertThat(TextNormalizer.normalize("Société Générale")).isEqualTo("societe generale");
        assertThat(TextNormalizer.normalize("  J.P.  Morgan!! ")).isEqualTo("j p morgan");
    }

    @Test
    void normalize_shouldBeTotal() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("   ")).isEmpty();
        assertThat(TextNormalizer.tokens(null)).isEmpty();
    }

    @Test
    void containsPhrase_shouldMatchWholeWordsOnly() {
        assertThat(TextNormalizer.containsPhrase("Associate, Leveraged Finance", "leveraged finance")).isTrue();
        assertThat(TextNormalizer.containsPhrase("Fixed Income Analyst", "Income Analyst")).isTrue();
        assertThat(TextNormalizer.containsPhrase("Financials Group", "fin")).isFalse();
        assertThat(TextNormalizer.containsPhrase("Anything", "")).isFalse();
    }
}
