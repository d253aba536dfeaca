package ru.javaboys.huntysourcing.engine;

import lombok.Value;
import org.springframework.lang.Nullable;

/**
 * One hit from the search provider.
 */
@Value
public class RawResult {
    String title;
    String url;
    @Nullable
    String snippet;
}
