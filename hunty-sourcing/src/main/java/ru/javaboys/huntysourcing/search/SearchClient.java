package ru.javaboys.huntysourcing.search;

import ru.javaboys.huntysourcing.engine.RawResult;

import java.util.List;

/**
 * Web search restricted to profile-like URLs.
 * Implementations return an empty list on any failure and never throw for "no results".
 */
public interface SearchClient {
    List<RawResult> search(String query, String apiKey);
}
