package ru.javaboys.huntysourcing.engine;

/**
 * How much weak evidence the current-role check and keyword matching accept.
 */
public enum PrecisionMode {
    /** explicit "at &lt;company&gt;" clause, whole keyword phrases only */
    STRICT,
    /** company must match the role text, phrase-level keyword variants */
    BALANCED,
    /** any company evidence including the snippet, all keyword variants */
    SEARCH
}
