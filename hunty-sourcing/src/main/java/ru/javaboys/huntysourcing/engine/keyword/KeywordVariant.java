package ru.javaboys.huntysourcing.engine.keyword;

import lombok.Value;

@Value
public class KeywordVariant {

    public enum Kind {
        PHRASE, SPLIT, STRIPPED, FRAGMENT, ACRONYM;

        public boolean isPhraseLevel() {
            return this == PHRASE || this == SPLIT || this == STRIPPED;
        }
    }

    String text;
    Kind kind;
}
